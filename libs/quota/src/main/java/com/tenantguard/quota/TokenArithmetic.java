package com.tenantguard.quota;

import com.tenantguard.quota.config.RateLimitConfig;
import com.tenantguard.quota.store.Bucket;

import java.time.Duration;
import java.time.Instant;

/**
 * Integer refill and retry arithmetic shared by the limiter and the status projection.
 * Fractional tokens are never granted.
 */
final class TokenArithmetic {

    private static final long MILLIS_PER_MINUTE = 60_000L;

    private TokenArithmetic() {
        // utility class
    }

    /** {@code floor(elapsedMinutes * refillRate)}; zero when the clock moved backwards. */
    static long tokensToAdd(Bucket bucket, RateLimitConfig config, Instant now) {
        long elapsedMillis = Math.max(0L, Duration.between(bucket.lastRefill(), now).toMillis());
        return elapsedMillis * config.refillRatePerMinute() / MILLIS_PER_MINUTE;
    }

    /**
     * The bucket with pending refill applied. {@code lastRefill} only moves when at least one
     * whole token is added; tokens are capped at {@code maxTokens}.
     */
    static Bucket refill(Bucket bucket, RateLimitConfig config, Instant now) {
        long toAdd = tokensToAdd(bucket, config, now);
        int capped = (int) Math.min(config.maxTokens(), bucket.tokens() + toAdd);
        if (toAdd > 0) {
            return bucket.withTokens(capped, now);
        }
        if (capped != bucket.tokens()) {
            return bucket.withTokens(capped, bucket.lastRefill());
        }
        return bucket;
    }

    /** Seconds until {@code tokens} more tokens have been refilled, at least 1. */
    static int secondsToRefill(long tokens, RateLimitConfig config) {
        long rate = config.refillRatePerMinute();
        return clampSeconds((tokens * 60 + rate - 1) / rate);
    }

    /** {@code duration} rounded up to whole seconds, at least 1. */
    static int ceilSeconds(Duration duration) {
        long millis = Math.max(0L, duration.toMillis());
        return clampSeconds((millis + 999) / 1000);
    }

    private static int clampSeconds(long seconds) {
        return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, seconds));
    }
}
