package com.warden.attestation;

import java.net.URI;
import java.time.Instant;

/**
 * Client of the auth service that vouches for external attestations.
 */
public interface AuthValidator {

    /**
     * Submits the attestation for validation. An explicit rejection is returned, not thrown.
     *
     * @param serviceUrl  auth service endpoint
     * @param attestation attestation fetched from the module
     * @param deadline    caller deadline, or null for none
     * @throws ValidationException if the service is unreachable or its answer is malformed
     */
    ValidationResult validate(URI serviceUrl, ExternalAttestation attestation, Instant deadline);
}
