package com.tenantguard.quota.store;

import java.time.Instant;

/**
 * Persisted token-bucket state for one {@code identityKind:identityValue:operation} key.
 *
 * @param key          bucket key
 * @param tokens       whole tokens currently available
 * @param lastRefill   when tokens were last added
 * @param violations   consecutive denials since the last successful request
 * @param blockedUntil end of the current penalty block, or {@code null}
 */
public record Bucket(String key, int tokens, Instant lastRefill, int violations, Instant blockedUntil) {

    public Bucket {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be null or blank");
        }
        if (tokens < 0) {
            throw new IllegalArgumentException("tokens must not be negative, got " + tokens);
        }
        if (lastRefill == null) {
            throw new IllegalArgumentException("lastRefill must not be null");
        }
        if (violations < 0) {
            throw new IllegalArgumentException("violations must not be negative, got " + violations);
        }
    }

    /** A full bucket as created on first use. */
    public static Bucket full(String key, int maxTokens, Instant now) {
        return new Bucket(key, maxTokens, now, 0, null);
    }

    public boolean isBlockedAt(Instant now) {
        return blockedUntil != null && blockedUntil.isAfter(now);
    }

    /** Whether a block was set and has ended by {@code now}. */
    public boolean hasExpiredBlockAt(Instant now) {
        return blockedUntil != null && !blockedUntil.isAfter(now);
    }

    public Bucket withTokens(int newTokens, Instant refilledAt) {
        return new Bucket(key, newTokens, refilledAt, violations, blockedUntil);
    }

    /** Consumes {@code cost} tokens, resetting violations and any stale block. */
    public Bucket consume(int cost) {
        return new Bucket(key, tokens - cost, lastRefill, 0, null);
    }

    public Bucket withViolation(int newViolations, Instant newBlockedUntil) {
        return new Bucket(key, tokens, lastRefill, newViolations, newBlockedUntil);
    }

    /** Clears the block and forgets past violations. */
    public Bucket unblocked() {
        return new Bucket(key, tokens, lastRefill, 0, null);
    }
}
