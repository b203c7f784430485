package com.warden.attestation;

/**
 * Thrown by {@link ConfigParser} when a configuration document cannot be accepted. Nothing is
 * published when this is thrown.
 */
public class InvalidConfigException extends AttestationException {

    public InvalidConfigException(String message) {
        this(message, null);
    }

    public InvalidConfigException(String message, Throwable cause) {
        this(ErrorKind.INVALID_CONFIG, message, cause);
    }

    protected InvalidConfigException(ErrorKind kind, String message, Throwable cause) {
        super(kind, AttestationStage.CONFIGURE, message, cause);
    }
}
