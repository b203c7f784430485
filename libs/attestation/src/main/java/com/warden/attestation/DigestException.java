package com.warden.attestation;

/**
 * Thrown by {@link ContentDigestor}. Digest failures are never retried: a binary that was
 * replaced or resized mid-attestation must fail the request.
 */
public class DigestException extends AttestationException {

    /** Which step of the digest failed. */
    public enum Failure {
        OPEN(ErrorKind.DIGEST_OPEN_ERROR),
        STAT(ErrorKind.DIGEST_STAT_ERROR),
        SIZE_LIMIT_EXCEEDED(ErrorKind.DIGEST_SIZE_LIMIT_EXCEEDED),
        READ(ErrorKind.DIGEST_READ_ERROR);

        private final ErrorKind kind;

        Failure(ErrorKind kind) {
            this.kind = kind;
        }

        public ErrorKind kind() {
            return kind;
        }
    }

    private final Failure failure;

    public DigestException(Failure failure, String message) {
        this(failure, message, null);
    }

    public DigestException(Failure failure, String message, Throwable cause) {
        super(failure.kind(), AttestationStage.DIGEST, "SHA256 digest: " + message, cause);
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }
}
