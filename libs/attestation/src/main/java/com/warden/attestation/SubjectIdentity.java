package com.warden.attestation;

/**
 * Identity asserted by the external attestation module.
 *
 * @param subjectName    subject the module vouches for
 * @param secret         per-subject secret marker
 * @param systemIdentity OS identity of the subject
 */
public record SubjectIdentity(String subjectName, String secret, SystemIdentity systemIdentity) {

    @Override
    public String toString() {
        return "SubjectIdentity[subjectName=%s, secret=[REDACTED], systemIdentity=%s]"
                .formatted(subjectName, systemIdentity);
    }
}
