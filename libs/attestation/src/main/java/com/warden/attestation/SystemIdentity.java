package com.warden.attestation;

import java.util.List;

/**
 * OS-level identity embedded in an external attestation.
 *
 * @param userId              uid
 * @param userName            user name, possibly empty
 * @param groupId             primary gid
 * @param groupName           primary group name, possibly empty
 * @param supplementaryGroups supplementary groups in module order
 */
public record SystemIdentity(
        String userId,
        String userName,
        String groupId,
        String groupName,
        List<GroupInfo> supplementaryGroups
) {

    public SystemIdentity {
        supplementaryGroups = supplementaryGroups == null ? List.of() : List.copyOf(supplementaryGroups);
    }
}
