package com.warden.attestation;

import java.util.Locale;

/**
 * Base class of every attestation failure.
 * <p>
 * Carries the {@link ErrorKind} the caller can switch on and the {@link AttestationStage} that
 * failed. The message is prefixed with the stage so log lines and RPC error descriptions say
 * where the pipeline stopped.
 */
public class AttestationException extends RuntimeException {

    private final ErrorKind kind;
    private final AttestationStage stage;

    public AttestationException(ErrorKind kind, AttestationStage stage, String message) {
        this(kind, stage, message, null);
    }

    public AttestationException(ErrorKind kind, AttestationStage stage, String message, Throwable cause) {
        super("%s: %s".formatted(stage.name().toLowerCase(Locale.ROOT), message), cause);
        this.kind = kind;
        this.stage = stage;
    }

    public ErrorKind kind() {
        return kind;
    }

    public AttestationStage stage() {
        return stage;
    }
}
