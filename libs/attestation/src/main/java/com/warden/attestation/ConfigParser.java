package com.warden.attestation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Decodes a raw configuration document into an {@link AttestorConfig}.
 * <p>
 * The document is a JSON object. Recognized keys:
 * <pre>
 * {
 *   "discover_workload_path": true,
 *   "workload_size_limit": 1048576,
 *   "external_attestation_socket": "/run/warden/module.sock",
 *   "external_auth_service_url": "https://auth.internal/validate"
 * }
 * </pre>
 * {@code user_attestation_module_path} and {@code user_attestation_service_url} are accepted as
 * older spellings of the two external keys. Unknown keys are ignored; missing keys take the
 * defaults of {@link AttestorConfig#defaults()}.
 */
public final class ConfigParser {

    static final String DISCOVER_WORKLOAD_PATH = "discover_workload_path";
    static final String WORKLOAD_SIZE_LIMIT = "workload_size_limit";
    static final String EXTERNAL_ATTESTATION_SOCKET = "external_attestation_socket";
    static final String EXTERNAL_AUTH_SERVICE_URL = "external_auth_service_url";
    static final String LEGACY_MODULE_PATH = "user_attestation_module_path";
    static final String LEGACY_SERVICE_URL = "user_attestation_service_url";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .build();

    private ConfigParser() {
        // utility class
    }

    /**
     * Parses and fully validates a configuration document.
     *
     * @throws EmptyConfigException   if the document is null or blank
     * @throws InvalidConfigException if the document is malformed or inconsistent
     */
    public static AttestorConfig parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new EmptyConfigException();
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new InvalidConfigException("failed to decode configuration: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidConfigException("failed to decode configuration: expected a JSON object");
        }

        boolean discoverWorkloadPath = readBoolean(root, DISCOVER_WORKLOAD_PATH);
        long workloadSizeLimit = readLong(root, WORKLOAD_SIZE_LIMIT);

        String socket = readString(root, EXTERNAL_ATTESTATION_SOCKET, LEGACY_MODULE_PATH);
        String url = readString(root, EXTERNAL_AUTH_SERVICE_URL, LEGACY_SERVICE_URL);
        if ((socket == null) != (url == null)) {
            throw new InvalidConfigException("%s and %s must be configured together"
                    .formatted(EXTERNAL_ATTESTATION_SOCKET, EXTERNAL_AUTH_SERVICE_URL));
        }

        return new AttestorConfig(
                discoverWorkloadPath,
                workloadSizeLimit,
                socket == null ? null : toSocketPath(socket),
                url == null ? null : toServiceUri(url));
    }

    private static boolean readBoolean(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return false;
        }
        if (!node.isBoolean()) {
            throw new InvalidConfigException("%s must be a boolean".formatted(key));
        }
        return node.booleanValue();
    }

    private static long readLong(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return 0;
        }
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new InvalidConfigException("%s must be a 64-bit integer".formatted(key));
        }
        return node.longValue();
    }

    private static String readString(JsonNode root, String key, String legacyKey) {
        String value = readString(root, key);
        return value != null ? value : readString(root, legacyKey);
    }

    private static String readString(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new InvalidConfigException("%s must be a string".formatted(key));
        }
        String value = node.textValue().strip();
        return value.isEmpty() ? null : value;
    }

    private static Path toSocketPath(String value) {
        Path path;
        try {
            path = Path.of(value);
        } catch (InvalidPathException e) {
            throw new InvalidConfigException("%s is not a valid path: %s".formatted(EXTERNAL_ATTESTATION_SOCKET, value), e);
        }
        if (!path.isAbsolute()) {
            throw new InvalidConfigException("%s must be an absolute path: %s".formatted(EXTERNAL_ATTESTATION_SOCKET, value));
        }
        return path.normalize();
    }

    private static URI toServiceUri(String value) {
        URI uri;
        try {
            uri = new URI(value);
        } catch (URISyntaxException e) {
            throw new InvalidConfigException("%s is not a valid URL: %s".formatted(EXTERNAL_AUTH_SERVICE_URL, value), e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if ((!scheme.equals("http") && !scheme.equals("https")) || uri.getHost() == null) {
            throw new InvalidConfigException("%s must be an absolute http(s) URL: %s".formatted(EXTERNAL_AUTH_SERVICE_URL, value));
        }
        return uri;
    }
}
