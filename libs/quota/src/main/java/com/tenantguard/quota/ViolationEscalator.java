package com.tenantguard.quota;

import java.time.Duration;

/**
 * Maps a count of consecutive denials to a penalty block.
 * <p>
 * Fewer than 5 violations carry no block; from there the block grows to 5 minutes, 15 minutes,
 * 1 hour and finally 24 hours at 50 or more. The mapping is monotonic and never permanent.
 */
public final class ViolationEscalator {

    private ViolationEscalator() {
        // utility class
    }

    public static Duration blockDurationFor(int violations) {
        if (violations < 0) {
            throw new IllegalArgumentException("violations must not be negative, got " + violations);
        }
        if (violations < 5) {
            return Duration.ZERO;
        }
        if (violations < 10) {
            return Duration.ofMinutes(5);
        }
        if (violations < 20) {
            return Duration.ofMinutes(15);
        }
        if (violations < 50) {
            return Duration.ofHours(1);
        }
        return Duration.ofHours(24);
    }
}
