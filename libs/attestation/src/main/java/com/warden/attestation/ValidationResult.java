package com.warden.attestation;

/**
 * Verdict of the auth service on one external attestation.
 *
 * @param valid   whether the attestation was accepted
 * @param message explanation from the auth service, possibly empty
 */
public record ValidationResult(boolean valid, String message) {

    public static ValidationResult accepted(String message) {
        return new ValidationResult(true, message == null ? "" : message);
    }

    public static ValidationResult rejected(String message) {
        return new ValidationResult(false, message == null ? "" : message);
    }
}
