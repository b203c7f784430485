package com.warden.attestorservice.infrastructure.auth;

import com.warden.attestation.AuthValidator;
import com.warden.attestation.ExternalAttestation;
import com.warden.attestation.ValidationException;
import com.warden.attestation.ValidationResult;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Validates external attestations against the auth service over HTTP.
 *
 * <p>POSTs {@code {token, identity}} as JSON and reads {@code {isValid, message}}. The request
 * runs on {@code executor} and is abandoned when the auth timeout or the caller deadline,
 * whichever is earlier, passes. Transport errors, non-2xx statuses and unreadable or empty bodies
 * become {@link ValidationException}; {@code isValid=false} is returned as a rejection.
 */
public class RestAuthValidator implements AuthValidator {

    private static final Logger log = LoggerFactory.getLogger(RestAuthValidator.class);

    private final RestClient restClient;
    private final Duration timeout;
    private final Executor executor;

    public RestAuthValidator(RestClient restClient, Duration timeout, Executor executor) {
        if (restClient == null || executor == null) {
            throw new IllegalArgumentException("restClient and executor must not be null");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.restClient = restClient;
        this.timeout = timeout;
        this.executor = executor;
    }

    @Override
    public ValidationResult validate(URI serviceUrl, ExternalAttestation attestation, Instant deadline) {
        if (serviceUrl == null || attestation == null) {
            throw new ValidationException("service URL and attestation are required");
        }
        Duration budget = budget(deadline, Instant.now());
        if (budget.isZero()) {
            throw new ValidationException("deadline exceeded before contacting auth service");
        }

        AuthValidationResponse response;
        try {
            response = CompletableFuture.supplyAsync(() -> post(serviceUrl, attestation), executor)
                    .orTimeout(budget.toMillis(), TimeUnit.MILLISECONDS)
                    .join();
        } catch (CompletionException e) {
            throw translate(serviceUrl, e.getCause() != null ? e.getCause() : e);
        }

        if (response == null || response.isValid() == null) {
            throw new ValidationException("auth service at %s returned no validation result".formatted(serviceUrl));
        }
        log.debug("Auth service at {} answered isValid={}", serviceUrl, response.isValid());
        return response.isValid()
                ? ValidationResult.accepted(response.message())
                : ValidationResult.rejected(response.message());
    }

    /** The auth timeout, cut short by {@code deadline} if earlier; zero when already past. */
    Duration budget(Instant deadline, Instant now) {
        if (deadline == null) {
            return timeout;
        }
        Duration remaining = Duration.between(now, deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            return Duration.ZERO;
        }
        return remaining.compareTo(timeout) < 0 ? remaining : timeout;
    }

    private AuthValidationResponse post(URI serviceUrl, ExternalAttestation attestation) {
        return restClient.post()
                .uri(serviceUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(AuthValidationRequest.from(attestation))
                .retrieve()
                .body(AuthValidationResponse.class);
    }

    private static ValidationException translate(URI serviceUrl, Throwable cause) {
        if (cause instanceof ValidationException validationException) {
            return validationException;
        }
        if (cause instanceof TimeoutException) {
            return new ValidationException("auth service at %s timed out".formatted(serviceUrl), cause);
        }
        if (cause instanceof RestClientException) {
            return new ValidationException(
                    "auth service at %s failed: %s".formatted(serviceUrl, cause.getMessage()), cause);
        }
        return new ValidationException(
                "unexpected error calling auth service at %s: %s".formatted(serviceUrl, cause.getMessage()), cause);
    }
}
