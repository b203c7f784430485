package com.warden.attestation;

import java.util.Optional;

/**
 * Maps numeric ids to names. Lookups are best-effort: any failure is reported as empty.
 */
public interface NameResolver {

    Optional<String> userNameFor(String uid);

    Optional<String> groupNameFor(String gid);
}
