package com.warden.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts sensitive fields from structured log data.
 * <p>
 * Attestation payloads from the external module carry a bearer token and a per-user secret;
 * neither may reach the logs. Field names are matched case-insensitively against the
 * configured patterns (substring match, so {@code userSecret} is caught by {@code secret}).
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "credential"
    );

    private final Pattern compiledPattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * @param patterns field name patterns to treat as sensitive (case-insensitive)
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        String regex = String.join("|", Set.copyOf(patterns).stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a new insertion-ordered map with sensitive values replaced by {@value #REDACTED}.
     * Null or empty input returns an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        data.forEach((key, value) -> result.put(key, isSensitive(key) ? REDACTED : value));
        return result;
    }

    /**
     * Redacts the value of a {@code kind:value} selector when one of its kind segments is
     * sensitive, e.g. {@code secret:abc} becomes {@code secret:[REDACTED]}. Everything after
     * the first sensitive segment is dropped, so values containing colons do not leak.
     */
    public String redactSelector(String selector) {
        if (selector == null) {
            return null;
        }
        String[] segments = selector.split(":", -1);
        StringBuilder kept = new StringBuilder();
        for (int i = 0; i < segments.length - 1; i++) {
            kept.append(segments[i]).append(':');
            if (isSensitive(segments[i])) {
                return kept + REDACTED;
            }
        }
        return selector;
    }

    /** Whether a field name matches any sensitive pattern. */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }
}
