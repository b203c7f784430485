package com.warden.attestation;

/**
 * Identity assertion fetched from the external attestation module.
 * <p>
 * Untrusted until an {@link AuthValidator} has accepted it. {@link #toString()} hides the token
 * and the secret.
 *
 * @param token    bearer token presented to the auth service
 * @param identity asserted identity
 */
public record ExternalAttestation(String token, SubjectIdentity identity) {

    @Override
    public String toString() {
        return "ExternalAttestation[token=[REDACTED], identity=%s]".formatted(identity);
    }
}
