package com.warden.attestation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * {@link NameResolver} over the {@code passwd} and {@code group} files of the OS identity
 * database.
 * <p>
 * Files are read on every lookup; users and groups may be added or removed between attestations.
 */
public final class IdentityDatabaseNameResolver implements NameResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityDatabaseNameResolver.class);

    static final Path DEFAULT_ROOT = Path.of("/etc");

    private final Path passwdFile;
    private final Path groupFile;

    public IdentityDatabaseNameResolver() {
        this(DEFAULT_ROOT);
    }

    /**
     * @param root directory holding {@code passwd} and {@code group}
     */
    public IdentityDatabaseNameResolver(Path root) {
        if (root == null) {
            throw new IllegalArgumentException("root must not be null");
        }
        this.passwdFile = root.resolve("passwd");
        this.groupFile = root.resolve("group");
    }

    @Override
    public Optional<String> userNameFor(String uid) {
        // name:password:uid:gid:gecos:home:shell
        return lookup(passwdFile, uid);
    }

    @Override
    public Optional<String> groupNameFor(String gid) {
        // name:password:gid:members
        return lookup(groupFile, gid);
    }

    private static Optional<String> lookup(Path file, String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank() || line.startsWith("#") || line.startsWith("+") || line.startsWith("-")) {
                    continue;
                }
                String[] parts = line.split(":", -1);
                if (parts.length >= 3 && parts[2].equals(id) && !parts[0].isEmpty()) {
                    return Optional.of(parts[0]);
                }
            }
            log.debug("No entry for id {} in {}", id, file);
        } catch (IOException e) {
            log.debug("Lookup of id {} in {} failed: {}", id, file, e.getMessage());
        }
        return Optional.empty();
    }
}
