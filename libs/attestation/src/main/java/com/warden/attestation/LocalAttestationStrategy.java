package com.warden.attestation;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Attests a process from local OS state: ids from the process table, names from the identity
 * database, and optionally the executable path and its digest.
 */
public final class LocalAttestationStrategy implements AttestationStrategy {

    private final ProcessIdentityResolver resolver;
    private final NameResolver nameResolver;
    private final ContentDigestor digestor;

    public LocalAttestationStrategy(ProcessIdentityResolver resolver, NameResolver nameResolver,
                                    ContentDigestor digestor) {
        if (resolver == null || nameResolver == null || digestor == null) {
            throw new IllegalArgumentException("resolver, nameResolver and digestor must not be null");
        }
        this.resolver = resolver;
        this.nameResolver = nameResolver;
        this.digestor = digestor;
    }

    @Override
    public AttestorConfig.Strategy kind() {
        return AttestorConfig.Strategy.LOCAL;
    }

    @Override
    public List<String> attest(int pid, AttestorConfig config, Instant deadline) {
        return SelectorBuilder.build(identify(pid, config));
    }

    /**
     * Resolves and enriches the identity of {@code pid} according to {@code config}.
     */
    public ProcessIdentity identify(int pid, AttestorConfig config) {
        ResolvedProcess proc = resolver.resolve(pid, config.discoverWorkloadPath());

        Map<String, Optional<String>> supplementaryNames = new LinkedHashMap<>();
        for (String sgid : proc.supplementaryGids()) {
            supplementaryNames.put(sgid, nameResolver.groupNameFor(sgid));
        }

        Optional<String> path = Optional.empty();
        Optional<String> digest = Optional.empty();
        if (config.discoverWorkloadPath()) {
            path = Optional.of(proc.executablePath());
            if (config.hashingEnabled()) {
                digest = Optional.of(digestor.digest(toPath(proc.namespacedPath()), config.workloadSizeLimit()));
            }
        }

        return new ProcessIdentity(
                proc.uid(),
                proc.gid(),
                proc.supplementaryGids(),
                nameResolver.userNameFor(proc.uid()),
                nameResolver.groupNameFor(proc.gid()),
                supplementaryNames,
                path,
                digest);
    }

    private static Path toPath(String namespacedPath) {
        try {
            return Path.of(namespacedPath);
        } catch (InvalidPathException e) {
            throw new DigestException(DigestException.Failure.OPEN, "open %s: %s".formatted(namespacedPath, e.getMessage()), e);
        }
    }
}
