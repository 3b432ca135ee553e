package com.bastion.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts sensitive fields from log data maps so that session cookies, password hashes and
 * secrets never reach log output.
 * <p>
 * Default sensitive patterns: password, hash, token, cookie, secret, authorization, credential.
 * Custom patterns can be supplied. All matching is case-insensitive.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    /** Number of leading characters {@link #mask(String)} keeps visible. */
    public static final int VISIBLE_PREFIX = 6;

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "hash", "token", "cookie",
            "secret", "authorization", "credential"
    );

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    /**
     * Creates a redactor with the default sensitive field patterns.
     */
    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * Creates a redactor with custom sensitive field patterns (case-insensitive).
     *
     * @param patterns field name patterns to treat as sensitive
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a new map with sensitive field values replaced by a masked form.
     * Non-sensitive fields are copied as-is. Null input returns an empty map.
     *
     * @param data the log data map (keys are field names, values are arbitrary)
     * @return a new map with sensitive values redacted
     */
    public Map<String, Object> redact(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }

        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            String key = entry.getKey();
            if (isSensitive(key)) {
                Object value = entry.getValue();
                result.put(key, value == null ? null : mask(value.toString()));
            } else {
                result.put(key, entry.getValue());
            }
        }
        return result;
    }

    /**
     * Masks a single sensitive value, keeping a short prefix so that log lines about the same
     * cookie can still be matched up. Values no longer than twice the prefix are fully redacted.
     *
     * @param value the raw value (may be null)
     * @return the masked value, or null for null input
     */
    public String mask(String value) {
        if (value == null) {
            return null;
        }
        if (value.length() <= VISIBLE_PREFIX * 2) {
            return REDACTED;
        }
        return value.substring(0, VISIBLE_PREFIX) + "..." + REDACTED;
    }

    /**
     * Checks whether a field name matches any sensitive pattern (case-insensitive).
     *
     * @param fieldName the field name to check
     * @return true if the field name contains a sensitive pattern
     */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }

    /**
     * Returns the set of sensitive patterns this redactor uses.
     */
    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }
}
