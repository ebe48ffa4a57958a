package com.tenantguard.quota;

/**
 * Who a bucket is charged to.
 * <p>
 * An authenticated user is always preferred over a network origin. Callers with neither share
 * the single {@code ip:unknown} identity, which isolates them from nobody; such subjects report
 * {@link #isDegraded()}.
 *
 * @param kind  identity kind
 * @param value user id or network origin
 */
public record RateLimitSubject(Kind kind, String value) {

    public static final String UNKNOWN_ORIGIN = "unknown";

    public enum Kind {
        USER("user"),
        IP("ip");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    public RateLimitSubject {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("value must not be null or blank");
        }
    }

    public static RateLimitSubject forUser(String userId) {
        return new RateLimitSubject(Kind.USER, userId);
    }

    public static RateLimitSubject forOrigin(String networkOrigin) {
        boolean missing = networkOrigin == null || networkOrigin.isBlank();
        return new RateLimitSubject(Kind.IP, missing ? UNKNOWN_ORIGIN : networkOrigin.strip());
    }

    /**
     * Picks the user when known, otherwise the network origin, otherwise the unknown origin.
     */
    public static RateLimitSubject of(String userId, String networkOrigin) {
        if (userId != null && !userId.isBlank()) {
            return forUser(userId);
        }
        return forOrigin(networkOrigin);
    }

    /** {@code kind:value}, as written to audit records. */
    public String identity() {
        return kind.prefix() + ":" + value;
    }

    /** {@code kind:value:operation}. */
    public String bucketKey(String operation) {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation must not be null or blank");
        }
        return identity() + ":" + operation;
    }

    public boolean isDegraded() {
        return kind == Kind.IP && UNKNOWN_ORIGIN.equals(value);
    }
}
