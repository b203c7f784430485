package com.warden.attestation;

/**
 * Thrown when the auth service answered and said the attestation is not valid.
 */
public class ValidationRejectedException extends AttestationException {

    private final String authorityMessage;

    public ValidationRejectedException(String authorityMessage) {
        super(ErrorKind.VALIDATION_REJECTED, AttestationStage.VALIDATE,
                "attestation rejected by auth service"
                        + (authorityMessage == null || authorityMessage.isBlank() ? "" : ": " + authorityMessage));
        this.authorityMessage = authorityMessage;
    }

    /** Message returned by the auth service, possibly empty. */
    public String authorityMessage() {
        return authorityMessage;
    }
}
