package com.warden.attestation;

/**
 * Thrown when the mandatory OS identity of a process (uid, gid, executable path, groups)
 * cannot be read.
 */
public class ResolutionException extends AttestationException {

    public ResolutionException(String message) {
        this(message, null);
    }

    public ResolutionException(String message, Throwable cause) {
        super(ErrorKind.RESOLUTION_ERROR, AttestationStage.RESOLVE, message, cause);
    }
}
