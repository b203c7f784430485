package com.warden.attestation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Reads the OS identity of a process through a {@link ProcessInfoSource}.
 * <p>
 * When the OS reports several candidate ids (real, effective, saved, filesystem), the second
 * one, the effective id, is used. A single id is used as is. No id at all is a failure.
 */
public final class ProcessIdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(ProcessIdentityResolver.class);

    private final ProcessInfoSource processInfoSource;

    public ProcessIdentityResolver(ProcessInfoSource processInfoSource) {
        if (processInfoSource == null) {
            throw new IllegalArgumentException("processInfoSource must not be null");
        }
        this.processInfoSource = processInfoSource;
    }

    /**
     * Resolves ids, supplementary groups and, when asked, the executable paths of {@code pid}.
     *
     * @param pid            process id
     * @param includeExePath whether to read the executable paths
     * @throws ResolutionException if any mandatory fact cannot be read
     */
    public ResolvedProcess resolve(int pid, boolean includeExePath) {
        if (pid <= 0) {
            throw new ResolutionException("invalid pid " + pid);
        }

        ProcessInfo proc;
        try {
            proc = processInfoSource.open(pid);
        } catch (IOException e) {
            throw new ResolutionException("failed to get process %d: %s".formatted(pid, e.getMessage()), e);
        }

        String uid = effectiveId("UIDs", readIds(proc, true));
        String gid = effectiveId("GIDs", readIds(proc, false));

        List<String> groups;
        try {
            groups = proc.groups();
        } catch (IOException e) {
            throw new ResolutionException("supplementary GIDs lookup: " + e.getMessage(), e);
        }

        String exePath = null;
        String namespacedPath = null;
        if (includeExePath) {
            try {
                exePath = proc.exe();
            } catch (IOException e) {
                throw new ResolutionException("path lookup: " + e.getMessage(), e);
            }
            try {
                namespacedPath = proc.namespacedExe();
            } catch (IOException e) {
                throw new ResolutionException("namespaced path lookup: " + e.getMessage(), e);
            }
        }

        log.debug("Resolved pid {}: uid={}, gid={}, supplementaryGids={}", pid, uid, gid, groups);
        return new ResolvedProcess(pid, uid, gid, groups, exePath, namespacedPath);
    }

    private static List<String> readIds(ProcessInfo proc, boolean user) {
        try {
            return user ? proc.uids() : proc.gids();
        } catch (IOException e) {
            throw new ResolutionException("%s lookup: %s".formatted(user ? "UIDs" : "GIDs", e.getMessage()), e);
        }
    }

    /**
     * Picks the effective id out of the candidates reported by the OS.
     */
    static String effectiveId(String label, List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new ResolutionException("%s lookup: no %s for process".formatted(label, label));
        }
        return ids.size() == 1 ? ids.get(0) : ids.get(1);
    }
}
