package com.warden.attestation;

/**
 * Thrown when the external attestation module cannot deliver an attestation. Connection
 * failures, timeouts and protocol errors are deliberately not distinguished.
 */
public class FetchException extends AttestationException {

    public FetchException(String message) {
        this(message, null);
    }

    public FetchException(String message, Throwable cause) {
        super(ErrorKind.FETCH_ERROR, AttestationStage.FETCH, message, cause);
    }
}
