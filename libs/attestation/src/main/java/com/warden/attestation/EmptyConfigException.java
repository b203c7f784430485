package com.warden.attestation;

/**
 * Thrown when the configuration document is null or blank.
 */
public class EmptyConfigException extends InvalidConfigException {

    public EmptyConfigException() {
        super(ErrorKind.EMPTY_CONFIG, "configuration cannot be empty", null);
    }
}
