package com.warden.attestation;

/**
 * Supplementary group as vouched for by the external attestation module.
 *
 * @param groupId   numeric group id
 * @param groupName group name, possibly empty
 */
public record GroupInfo(String groupId, String groupName) {
}
