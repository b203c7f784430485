package com.warden.attestation;

import java.time.Instant;
import java.util.List;

/**
 * One way of turning a pid into selectors. The {@link Attestor} picks the strategy for every
 * request from the active configuration.
 */
public interface AttestationStrategy {

    AttestorConfig.Strategy kind();

    /**
     * @param pid      process under attestation
     * @param config   configuration snapshot of this request
     * @param deadline caller deadline, or null for none
     * @return ordered selectors; never a partial list
     * @throws AttestationException tagged with the stage that failed
     */
    List<String> attest(int pid, AttestorConfig config, Instant deadline);
}
