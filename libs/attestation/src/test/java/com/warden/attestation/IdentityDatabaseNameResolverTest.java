package com.warden.attestation;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("IdentityDatabaseNameResolver")
class IdentityDatabaseNameResolverTest {

    @TempDir
    Path etc;

    private IdentityDatabaseNameResolver resolver;

    @BeforeEach
    void writeDatabase() throws IOException {
        Files.writeString(etc.resolve("passwd"), """
                # local users
                root:x:0:0:root:/root:/bin/bash
                alice:x:1000:1000:Alice:/home/alice:/bin/bash
                +nisuser:x:2000:2000::/home/nis:/bin/sh
                broken-line
                """);
        Files.writeString(etc.resolve("group"), """
                root:x:0:
                sudo:x:27:alice
                alice:x:1000:
                """);
        resolver = new IdentityDatabaseNameResolver(etc);
    }

    @Test
    @DisplayName("resolves known users and groups")
    void resolvesKnownIds() {
        assertThat(resolver.userNameFor("1000")).contains("alice");
        assertThat(resolver.userNameFor("0")).contains("root");
        assertThat(resolver.groupNameFor("27")).contains("sudo");
    }

    @Test
    @DisplayName("unknown ids are absent")
    void unknownIdsAbsent() {
        assertThat(resolver.userNameFor("4242")).isEmpty();
        assertThat(resolver.groupNameFor("4242")).isEmpty();
    }

    @Test
    @DisplayName("NIS compat entries are skipped")
    void skipsCompatEntries() {
        assertThat(resolver.userNameFor("2000")).isEmpty();
    }

    @Test
    @DisplayName("a missing database file is absent, not an error")
    void missingFileIsAbsent() {
        var empty = new IdentityDatabaseNameResolver(etc.resolve("nowhere"));

        assertThat(empty.userNameFor("0")).isEmpty();
        assertThat(empty.groupNameFor("0")).isEmpty();
    }

    @Test
    @DisplayName("a deleted user disappears on the next lookup")
    void rereadsOnEveryLookup() throws IOException {
        assertThat(resolver.userNameFor("1000")).contains("alice");

        Files.writeString(etc.resolve("passwd"), "root:x:0:0:root:/root:/bin/bash\n");

        assertThat(resolver.userNameFor("1000")).isEmpty();
    }
}
