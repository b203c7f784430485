package com.warden.attestation;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Client of the external attestation module.
 * <p>
 * Implementations make exactly one request per call, bound it by a short fixed timeout (and by
 * {@code deadline}, when earlier), and never retry or cache.
 */
public interface AttestationModuleClient {

    /**
     * @param socketPath unix socket of the module
     * @param deadline   caller deadline, or null for none
     * @throws FetchException on connection failure, timeout, RPC error or incomplete response
     */
    ExternalAttestation fetch(Path socketPath, Instant deadline);
}
