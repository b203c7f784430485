package com.warden.attestation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Entry point of the attestation pipeline.
 * <p>
 * Each request reads the configuration snapshot once, picks the local or external strategy from
 * it and returns that strategy's selectors. Every failure surfaces as an
 * {@link AttestationException}; a request never yields a partial list.
 */
public final class Attestor {

    private static final Logger log = LoggerFactory.getLogger(Attestor.class);

    private final ConfigStore configStore;
    private final AttestationStrategy local;
    private final AttestationStrategy external;

    public Attestor(ConfigStore configStore, AttestationStrategy local, AttestationStrategy external) {
        if (configStore == null || local == null || external == null) {
            throw new IllegalArgumentException("configStore, local and external must not be null");
        }
        if (local.kind() != AttestorConfig.Strategy.LOCAL || external.kind() != AttestorConfig.Strategy.EXTERNAL) {
            throw new IllegalArgumentException("strategies passed in the wrong slots");
        }
        this.configStore = configStore;
        this.local = local;
        this.external = external;
    }

    /** Attests {@code pid} without a caller deadline. */
    public List<String> attest(int pid) {
        return attest(pid, null);
    }

    /**
     * Attests {@code pid}.
     *
     * @param deadline caller deadline propagated to network calls, or null
     * @throws NotConfiguredException if no configuration is active
     * @throws AttestationException   if any stage fails
     */
    public List<String> attest(int pid, Instant deadline) {
        return attest(configStore.current(), pid, deadline);
    }

    /**
     * Attests {@code pid} against a snapshot the caller already holds, so the caller can label
     * the request with the strategy that actually ran.
     *
     * @param snapshot configuration to attest with
     * @param deadline caller deadline propagated to network calls, or null
     * @throws AttestationException if any stage fails
     */
    public List<String> attest(ConfigSnapshot snapshot, int pid, Instant deadline) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot must not be null");
        }
        AttestationStrategy strategy = strategyFor(snapshot.config());
        log.debug("Attesting pid {} with {} strategy (config v{})", pid, strategy.kind(), snapshot.version());

        List<String> selectors = strategy.attest(pid, snapshot.config(), deadline);
        log.debug("Attested pid {}: {} selectors", pid, selectors.size());
        return selectors;
    }

    /** Strategy the given configuration selects. */
    public AttestationStrategy strategyFor(AttestorConfig config) {
        return config.strategy() == AttestorConfig.Strategy.EXTERNAL ? external : local;
    }

    public ConfigStore configStore() {
        return configStore;
    }
}
