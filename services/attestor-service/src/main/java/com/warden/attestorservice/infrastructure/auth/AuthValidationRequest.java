package com.warden.attestorservice.infrastructure.auth;

import com.warden.attestation.ExternalAttestation;
import com.warden.attestation.GroupInfo;
import com.warden.attestation.SubjectIdentity;
import com.warden.attestation.SystemIdentity;
import java.util.List;

/**
 * Body POSTed to the auth service: the module's token plus the identity it asserted.
 */
public record AuthValidationRequest(String token, Identity identity) {

    public record Identity(String name, String secret, SystemInfo systemInfo) {
    }

    public record SystemInfo(
            String userId, String username, String groupId, String groupName, List<Group> supplementaryGroups) {
    }

    public record Group(String groupId, String groupName) {
    }

    static AuthValidationRequest from(ExternalAttestation attestation) {
        SubjectIdentity subject = attestation.identity();
        SystemInfo systemInfo = null;
        if (subject.systemIdentity() != null) {
            SystemIdentity system = subject.systemIdentity();
            List<Group> groups = system.supplementaryGroups().stream()
                    .map(AuthValidationRequest::toGroup)
                    .toList();
            systemInfo = new SystemInfo(system.userId(), system.userName(), system.groupId(), system.groupName(), groups);
        }
        return new AuthValidationRequest(attestation.token(), new Identity(subject.subjectName(), subject.secret(), systemInfo));
    }

    private static Group toGroup(GroupInfo group) {
        return new Group(group.groupId(), group.groupName());
    }

    @Override
    public String toString() {
        return "AuthValidationRequest[token=[REDACTED], identity=%s]".formatted(identity == null ? null : identity.name());
    }
}
