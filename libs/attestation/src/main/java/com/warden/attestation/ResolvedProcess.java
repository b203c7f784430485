package com.warden.attestation;

import java.util.List;

/**
 * OS ids and executable location of a process, before name enrichment and hashing.
 *
 * @param pid               process id
 * @param uid               effective uid
 * @param gid               effective gid
 * @param supplementaryGids supplementary gids in the order the OS reports them
 * @param executablePath    executable as reported by the OS; null unless requested
 * @param namespacedPath    executable as reachable from this process; null unless requested
 */
public record ResolvedProcess(
        int pid,
        String uid,
        String gid,
        List<String> supplementaryGids,
        String executablePath,
        String namespacedPath
) {

    public ResolvedProcess {
        supplementaryGids = List.copyOf(supplementaryGids);
    }
}
