package com.warden.attestation;

import java.net.URI;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Immutable attestor configuration.
 * <p>
 * The size limit has three meanings: negative skips hashing entirely, zero hashes without a
 * cap, and a positive value caps the executable size in bytes.
 *
 * @param discoverWorkloadPath      emit the executable path (and digest, per the size limit)
 * @param workloadSizeLimit         size policy for the executable digest
 * @param externalAttestationSocket unix socket of the attestation module, or null
 * @param externalAuthServiceUrl    auth service endpoint, or null
 */
public record AttestorConfig(
        boolean discoverWorkloadPath,
        long workloadSizeLimit,
        Path externalAttestationSocket,
        URI externalAuthServiceUrl
) {

    /** Which pipeline a configuration selects. */
    public enum Strategy {
        LOCAL,
        EXTERNAL
    }

    public AttestorConfig {
        if ((externalAttestationSocket == null) != (externalAuthServiceUrl == null)) {
            throw new IllegalArgumentException(
                    "externalAttestationSocket and externalAuthServiceUrl must be set together");
        }
    }

    /** Configuration with every option at its default: local strategy, no path discovery. */
    public static AttestorConfig defaults() {
        return new AttestorConfig(false, 0, null, null);
    }

    public Strategy strategy() {
        return externalAttestationSocket != null ? Strategy.EXTERNAL : Strategy.LOCAL;
    }

    /** Whether the executable digest is computed when path discovery is on. */
    public boolean hashingEnabled() {
        return workloadSizeLimit >= 0;
    }

    public Optional<Path> attestationSocket() {
        return Optional.ofNullable(externalAttestationSocket);
    }

    public Optional<URI> authServiceUrl() {
        return Optional.ofNullable(externalAuthServiceUrl);
    }
}
