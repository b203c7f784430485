package com.warden.attestation;

/**
 * Thrown when an attestation is requested before any configuration was published.
 */
public class NotConfiguredException extends AttestationException {

    public NotConfiguredException() {
        super(ErrorKind.NOT_CONFIGURED, AttestationStage.READ_CONFIG, "not configured");
    }
}
