package com.warden.attestation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolved identity of a process, as turned into selectors by {@link SelectorBuilder}.
 * Built fresh for every request.
 *
 * @param uid                     effective uid
 * @param gid                     effective gid
 * @param supplementaryGids       supplementary gids, in OS order
 * @param userName                name of {@code uid}, if the identity database knows it
 * @param groupName               name of {@code gid}, if the identity database knows it
 * @param supplementaryGroupNames name per supplementary gid, iterated in {@code supplementaryGids} order
 * @param executablePath          executable path when path discovery is on
 * @param contentDigest           lowercase hex SHA-256 of the executable when hashing is on
 */
public record ProcessIdentity(
        String uid,
        String gid,
        List<String> supplementaryGids,
        Optional<String> userName,
        Optional<String> groupName,
        Map<String, Optional<String>> supplementaryGroupNames,
        Optional<String> executablePath,
        Optional<String> contentDigest
) {

    public ProcessIdentity {
        if (uid == null || uid.isBlank()) {
            throw new IllegalArgumentException("uid must not be null or blank");
        }
        if (gid == null || gid.isBlank()) {
            throw new IllegalArgumentException("gid must not be null or blank");
        }
        supplementaryGids = supplementaryGids == null ? List.of() : List.copyOf(supplementaryGids);
        userName = userName == null ? Optional.empty() : userName;
        groupName = groupName == null ? Optional.empty() : groupName;
        Map<String, Optional<String>> names = new LinkedHashMap<>();
        for (String sgid : supplementaryGids) {
            Optional<String> name = supplementaryGroupNames == null ? null : supplementaryGroupNames.get(sgid);
            names.put(sgid, name == null ? Optional.empty() : name);
        }
        supplementaryGroupNames = Collections.unmodifiableMap(names);
        executablePath = executablePath == null ? Optional.empty() : executablePath;
        contentDigest = contentDigest == null ? Optional.empty() : contentDigest;
    }

    /** Identity with only the mandatory ids. */
    public static ProcessIdentity of(String uid, String gid) {
        return new ProcessIdentity(uid, gid, List.of(), Optional.empty(), Optional.empty(),
                Map.of(), Optional.empty(), Optional.empty());
    }
}
