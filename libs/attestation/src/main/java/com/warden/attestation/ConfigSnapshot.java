package com.warden.attestation;

/**
 * A published configuration together with its publication number. Versions start at 1 and
 * grow by one per successful {@link ConfigStore#configure(String)}.
 */
public record ConfigSnapshot(long version, AttestorConfig config) {

    public ConfigSnapshot {
        if (version < 1) {
            throw new IllegalArgumentException("version must be positive");
        }
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
    }
}
