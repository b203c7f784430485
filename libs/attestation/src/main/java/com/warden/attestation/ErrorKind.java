package com.warden.attestation;

/**
 * Machine-readable failure kinds reported to the attestation caller.
 */
public enum ErrorKind {

    /** No configuration has been published yet. */
    NOT_CONFIGURED,

    /** The configuration document is malformed or inconsistent. */
    INVALID_CONFIG,

    /** The configuration document is blank. */
    EMPTY_CONFIG,

    /** The OS identity of the process could not be read. */
    RESOLUTION_ERROR,

    /** The executable could not be opened. */
    DIGEST_OPEN_ERROR,

    /** The executable size could not be read. */
    DIGEST_STAT_ERROR,

    /** The executable is larger than the configured limit. */
    DIGEST_SIZE_LIMIT_EXCEEDED,

    /** The executable could not be read to the end. */
    DIGEST_READ_ERROR,

    /** The external attestation module was unreachable, too slow, or answered badly. */
    FETCH_ERROR,

    /** The auth service was unreachable or answered badly. */
    VALIDATION_ERROR,

    /** The auth service explicitly rejected the attestation. */
    VALIDATION_REJECTED
}
