package com.tenantguard.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Masks credential-like entries in free-form metadata before it reaches a log or audit sink.
 * <p>
 * A key is sensitive when it contains one of the configured fragments, case-insensitively.
 * Nested maps are redacted recursively; other values are copied as-is.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_FRAGMENTS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "api_key", "credential", "cookie");

    private final Pattern sensitiveKey;

    public SensitiveDataRedactor() {
        this(DEFAULT_FRAGMENTS);
    }

    /**
     * @param fragments key fragments treated as sensitive; must not be empty
     */
    public SensitiveDataRedactor(Set<String> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            throw new IllegalArgumentException("fragments must not be empty");
        }
        String regex = fragments.stream().map(Pattern::quote).collect(Collectors.joining("|"));
        this.sensitiveKey = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a redacted copy of {@code data}; {@code null} yields an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>(data.size());
        data.forEach((key, value) -> copy.put(key, redactValue(key, value)));
        return copy;
    }

    public boolean isSensitive(String key) {
        return key != null && sensitiveKey.matcher(key).find();
    }

    @SuppressWarnings("unchecked")
    private Object redactValue(String key, Object value) {
        if (isSensitive(key)) {
            return REDACTED;
        }
        if (value instanceof Map<?, ?> nested) {
            return redact((Map<String, ?>) nested);
        }
        return value;
    }
}
