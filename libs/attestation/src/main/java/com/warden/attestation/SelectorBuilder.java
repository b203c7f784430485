package com.warden.attestation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Builds ordered {@code kind:value} selectors from a resolved identity.
 * <p>
 * Output is a pure function of the input: equal identities give equal lists.
 */
public final class SelectorBuilder {

    public static final String UID = "uid";
    public static final String USER = "user";
    public static final String GID = "gid";
    public static final String GROUP = "group";
    public static final String SUPPLEMENTARY_GID = "supplementary_gid";
    public static final String SUPPLEMENTARY_GROUP = "supplementary_group";
    public static final String PATH = "path";
    public static final String SHA256 = "sha256";

    public static final String NAME = "name";
    public static final String SECRET = "secret";
    public static final String SYSTEM_USER_ID = "system:user_id";
    public static final String SYSTEM_USERNAME = "system:username";
    public static final String SYSTEM_GROUP_ID = "system:group_id";
    public static final String SYSTEM_GROUP_NAME = "system:groupName";
    public static final String SYSTEM_SUPPLEMENTARY_GROUP_ID = "system:supplementary_group_id";
    public static final String SYSTEM_SUPPLEMENTARY_GROUP_NAME = "system:supplementary_group_name";

    private SelectorBuilder() {
        // utility class
    }

    /**
     * Selectors of a locally resolved process: uid, user, gid, group, each supplementary gid
     * followed by its name, then path and sha256. Absent values are skipped.
     */
    public static List<String> build(ProcessIdentity identity) {
        List<String> selectors = new ArrayList<>();
        selectors.add(selector(UID, identity.uid()));
        identity.userName().ifPresent(name -> selectors.add(selector(USER, name)));
        selectors.add(selector(GID, identity.gid()));
        identity.groupName().ifPresent(name -> selectors.add(selector(GROUP, name)));

        for (String sgid : identity.supplementaryGids()) {
            selectors.add(selector(SUPPLEMENTARY_GID, sgid));
            identity.supplementaryGroupNames().getOrDefault(sgid, Optional.empty())
                    .ifPresent(name -> selectors.add(selector(SUPPLEMENTARY_GROUP, name)));
        }

        identity.executablePath().ifPresent(path -> selectors.add(selector(PATH, path)));
        identity.contentDigest().ifPresent(digest -> selectors.add(selector(SHA256, digest)));
        return Collections.unmodifiableList(selectors);
    }

    /**
     * Selectors of a validated external identity: subject name, secret, then the embedded
     * system identity in the same order as {@link #build(ProcessIdentity)}. Empty names are
     * skipped.
     */
    public static List<String> build(SubjectIdentity identity) {
        SystemIdentity system = identity.systemIdentity();
        List<String> selectors = new ArrayList<>();
        selectors.add(selector(NAME, identity.subjectName()));
        selectors.add(selector(SECRET, identity.secret()));
        selectors.add(selector(SYSTEM_USER_ID, system.userId()));
        addIfPresent(selectors, SYSTEM_USERNAME, system.userName());
        selectors.add(selector(SYSTEM_GROUP_ID, system.groupId()));
        addIfPresent(selectors, SYSTEM_GROUP_NAME, system.groupName());

        for (GroupInfo group : system.supplementaryGroups()) {
            selectors.add(selector(SYSTEM_SUPPLEMENTARY_GROUP_ID, group.groupId()));
            addIfPresent(selectors, SYSTEM_SUPPLEMENTARY_GROUP_NAME, group.groupName());
        }
        return Collections.unmodifiableList(selectors);
    }

    /** Formats one selector as {@code kind:value}. */
    public static String selector(String kind, String value) {
        return kind + ":" + value;
    }

    private static void addIfPresent(List<String> selectors, String kind, String value) {
        if (value != null && !value.isEmpty()) {
            selectors.add(selector(kind, value));
        }
    }
}
