package com.warden.attestation;

/**
 * Stages of one attestation request. Failures are tagged with the stage that produced them.
 */
public enum AttestationStage {
    CONFIGURE,
    READ_CONFIG,
    RESOLVE,
    DIGEST,
    FETCH,
    VALIDATE,
    BUILD_SELECTORS
}
