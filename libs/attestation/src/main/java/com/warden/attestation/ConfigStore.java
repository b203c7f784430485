package com.warden.attestation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds the active attestor configuration.
 * <p>
 * {@link #configure(String)} parses and validates outside the lock, then publishes a new
 * {@link ConfigSnapshot} under the write lock. Readers share the read lock and always see a
 * complete snapshot. The lock is fair, so a waiting writer is not starved by a stream of
 * readers. Concurrent writers are applied in lock order: the last one wins.
 */
public final class ConfigStore {

    private static final Logger log = LoggerFactory.getLogger(ConfigStore.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock(true);
    private ConfigSnapshot snapshot;

    /**
     * Parses {@code raw} and publishes it as the active configuration.
     *
     * @return the published snapshot
     * @throws EmptyConfigException   if {@code raw} is blank
     * @throws InvalidConfigException if {@code raw} is malformed; the active config is unchanged
     */
    public ConfigSnapshot configure(String raw) {
        AttestorConfig config = ConfigParser.parse(raw);
        return publish(config);
    }

    /**
     * Publishes an already validated configuration.
     */
    public ConfigSnapshot publish(AttestorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        ConfigSnapshot published;
        lock.writeLock().lock();
        try {
            long version = snapshot == null ? 1 : snapshot.version() + 1;
            published = new ConfigSnapshot(version, config);
            snapshot = published;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Published attestor configuration v{}: strategy={}, discoverWorkloadPath={}, workloadSizeLimit={}",
                published.version(), config.strategy(), config.discoverWorkloadPath(), config.workloadSizeLimit());
        return published;
    }

    /**
     * Returns the active snapshot.
     *
     * @throws NotConfiguredException if nothing has been published yet
     */
    public ConfigSnapshot current() {
        lock.readLock().lock();
        try {
            if (snapshot == null) {
                throw new NotConfiguredException();
            }
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isConfigured() {
        lock.readLock().lock();
        try {
            return snapshot != null;
        } finally {
            lock.readLock().unlock();
        }
    }
}
