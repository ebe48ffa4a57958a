package com.tenantguard.quota.config;

/**
 * Limits for one operation family.
 *
 * @param maxTokens           bucket capacity, also the size of a burst
 * @param refillRatePerMinute whole tokens added per elapsed minute
 * @param costPerRequest      tokens consumed by one request unless overridden
 */
public record RateLimitConfig(int maxTokens, int refillRatePerMinute, int costPerRequest) {

    public RateLimitConfig {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got " + maxTokens);
        }
        if (refillRatePerMinute <= 0) {
            throw new IllegalArgumentException("refillRatePerMinute must be positive, got " + refillRatePerMinute);
        }
        if (costPerRequest <= 0 || costPerRequest > maxTokens) {
            throw new IllegalArgumentException(
                    "costPerRequest must be in 1..%d, got %d".formatted(maxTokens, costPerRequest));
        }
    }
}
