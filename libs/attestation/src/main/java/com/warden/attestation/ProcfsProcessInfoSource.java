package com.warden.attestation;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link ProcessInfoSource} backed by the {@code /proc} tree.
 * <p>
 * The root of the tree defaults to {@code /proc} and can be moved with the {@code HOST_PROC}
 * environment variable, for agents that see the host's process table mounted elsewhere.
 * The status record is read once when the process is opened, so the ids of one request come
 * from a single read.
 */
public final class ProcfsProcessInfoSource implements ProcessInfoSource {

    /** Environment variable overriding the process-information root. */
    public static final String HOST_PROC_ENV = "HOST_PROC";

    static final Path DEFAULT_PROC_ROOT = Path.of("/proc");

    private final Path procRoot;
    private final boolean linux;

    /**
     * @param procRoot root of the process-information tree
     * @param linux    whether the status record carries a {@code Groups} field and
     *                 {@code <pid>/exe} is a namespaced link
     */
    public ProcfsProcessInfoSource(Path procRoot, boolean linux) {
        if (procRoot == null) {
            throw new IllegalArgumentException("procRoot must not be null");
        }
        this.procRoot = procRoot;
        this.linux = linux;
    }

    /**
     * Creates a source for the running platform, honouring {@code HOST_PROC}.
     */
    public static ProcfsProcessInfoSource fromEnvironment() {
        return new ProcfsProcessInfoSource(resolveProcRoot(System.getenv(HOST_PROC_ENV)), isLinux());
    }

    /** {@code override} when set, otherwise {@code /proc}. */
    public static Path resolveProcRoot(String override) {
        return override == null || override.isBlank() ? DEFAULT_PROC_ROOT : Path.of(override);
    }

    public static boolean isLinux() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("linux");
    }

    public Path procRoot() {
        return procRoot;
    }

    @Override
    public ProcessInfo open(int pid) throws IOException {
        Path processDir = procRoot.resolve(Integer.toString(pid));
        if (!Files.isDirectory(processDir)) {
            throw new NoSuchFileException(processDir.toString(), null, "process does not exist");
        }
        return new ProcfsProcessInfo(pid, processDir, readStatus(processDir.resolve("status")), linux);
    }

    /**
     * Reads {@code key: value} rows of a status record. Keys are lower-cased; the first
     * occurrence of a key wins.
     */
    static Map<String, String> readStatus(Path statusPath) throws IOException {
        Map<String, String> fields = new LinkedHashMap<>();
        try (BufferedReader reader = Files.newBufferedReader(statusPath, StandardCharsets.UTF_8)) {
            String row;
            while ((row = reader.readLine()) != null) {
                int sep = row.indexOf(':');
                if (sep < 0) {
                    continue;
                }
                String key = row.substring(0, sep).strip().toLowerCase(Locale.ROOT);
                fields.putIfAbsent(key, row.substring(sep + 1).strip());
            }
        }
        return fields;
    }

    static List<String> fields(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.asList(value.strip().split("\\s+"));
    }

    private static final class ProcfsProcessInfo implements ProcessInfo {

        private final int pid;
        private final Path processDir;
        private final Map<String, String> status;
        private final boolean linux;

        ProcfsProcessInfo(int pid, Path processDir, Map<String, String> status, boolean linux) {
            this.pid = pid;
            this.processDir = processDir;
            this.status = status;
            this.linux = linux;
        }

        @Override
        public int pid() {
            return pid;
        }

        @Override
        public List<String> uids() {
            return List.copyOf(fields(status.get("uid")));
        }

        @Override
        public List<String> gids() {
            return List.copyOf(fields(status.get("gid")));
        }

        @Override
        public List<String> groups() {
            if (!linux) {
                return List.of();
            }
            return List.copyOf(fields(status.get("groups")));
        }

        @Override
        public String exe() throws IOException {
            return Files.readSymbolicLink(processDir.resolve("exe")).toString();
        }

        @Override
        public String namespacedExe() throws IOException {
            if (linux) {
                return processDir.resolve("exe").toString();
            }
            return exe();
        }
    }
}
