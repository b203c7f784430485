package com.warden.attestation;

/**
 * Thrown when the auth service is unreachable or returns something that is not a validation
 * result.
 */
public class ValidationException extends AttestationException {

    public ValidationException(String message) {
        this(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION_ERROR, AttestationStage.VALIDATE, message, cause);
    }
}
