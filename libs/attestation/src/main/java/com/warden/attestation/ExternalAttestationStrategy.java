package com.warden.attestation;

import com.warden.observability.SensitiveDataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attests a process through the external pipeline: fetch an assertion from the attestation
 * module, have the auth service validate it, then build selectors from the validated identity.
 * <p>
 * Nothing from the fetched assertion reaches the output unless validation returned
 * {@code valid = true}. A rejection and a validator failure both end the request.
 */
public final class ExternalAttestationStrategy implements AttestationStrategy {

    private static final Logger log = LoggerFactory.getLogger(ExternalAttestationStrategy.class);

    private final AttestationModuleClient moduleClient;
    private final AuthValidator authValidator;
    private final SensitiveDataRedactor redactor;

    public ExternalAttestationStrategy(AttestationModuleClient moduleClient, AuthValidator authValidator) {
        this(moduleClient, authValidator, new SensitiveDataRedactor());
    }

    public ExternalAttestationStrategy(AttestationModuleClient moduleClient, AuthValidator authValidator,
                                       SensitiveDataRedactor redactor) {
        if (moduleClient == null || authValidator == null || redactor == null) {
            throw new IllegalArgumentException("moduleClient, authValidator and redactor must not be null");
        }
        this.moduleClient = moduleClient;
        this.authValidator = authValidator;
        this.redactor = redactor;
    }

    @Override
    public AttestorConfig.Strategy kind() {
        return AttestorConfig.Strategy.EXTERNAL;
    }

    @Override
    public List<String> attest(int pid, AttestorConfig config, Instant deadline) {
        Path socket = config.attestationSocket()
                .orElseThrow(() -> new IllegalStateException("external strategy without attestation socket"));
        URI serviceUrl = config.authServiceUrl()
                .orElseThrow(() -> new IllegalStateException("external strategy without auth service URL"));

        ExternalAttestation attestation = fetch(socket, deadline);
        if (log.isDebugEnabled()) {
            log.debug("Fetched attestation for pid {}: {}", pid, redactor.redact(describe(attestation)));
        }

        ValidationResult result = validate(serviceUrl, attestation, deadline);
        if (result == null) {
            throw new ValidationException("auth service returned no result");
        }
        if (!result.valid()) {
            throw new ValidationRejectedException(result.message());
        }
        log.debug("Attestation for pid {} validated: {}", pid, result.message());

        return SelectorBuilder.build(attestation.identity());
    }

    private ExternalAttestation fetch(Path socket, Instant deadline) {
        ExternalAttestation attestation;
        try {
            attestation = moduleClient.fetch(socket, deadline);
        } catch (AttestationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FetchException("failed to get attestation data: " + e.getMessage(), e);
        }
        requireComplete(attestation);
        return attestation;
    }

    private ValidationResult validate(URI serviceUrl, ExternalAttestation attestation, Instant deadline) {
        try {
            return authValidator.validate(serviceUrl, attestation, deadline);
        } catch (AttestationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ValidationException("failed to validate data: " + e.getMessage(), e);
        }
    }

    /**
     * Rejects assertions missing a field that every selector list needs.
     */
    static void requireComplete(ExternalAttestation attestation) {
        if (attestation == null) {
            throw new FetchException("attestation module returned no attestation");
        }
        if (isBlank(attestation.token())) {
            throw new FetchException("attestation has no token");
        }
        SubjectIdentity identity = attestation.identity();
        if (identity == null || isBlank(identity.subjectName()) || isBlank(identity.secret())) {
            throw new FetchException("attestation has no subject name or secret");
        }
        SystemIdentity system = identity.systemIdentity();
        if (system == null || isBlank(system.userId()) || isBlank(system.groupId())) {
            throw new FetchException("attestation has no system user or group id");
        }
        for (GroupInfo group : system.supplementaryGroups()) {
            if (group == null || isBlank(group.groupId())) {
                throw new FetchException("attestation has a supplementary group without id");
            }
        }
    }

    private static Map<String, Object> describe(ExternalAttestation attestation) {
        SubjectIdentity identity = attestation.identity();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("token", attestation.token());
        fields.put("subjectName", identity.subjectName());
        fields.put("secret", identity.secret());
        fields.put("userId", identity.systemIdentity().userId());
        fields.put("groupId", identity.systemIdentity().groupId());
        fields.put("supplementaryGroups", identity.systemIdentity().supplementaryGroups().size());
        return fields;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
