package com.tenantguard.quota;

import java.time.Duration;
import java.util.OptionalInt;

/**
 * Result of one limiter check.
 *
 * @param allowed         whether the request may proceed
 * @param tokensRemaining tokens left after the check
 * @param resetInSeconds  retry guidance, {@code null} when allowed and at least 1 when denied
 * @param reason          why the request was allowed or denied
 * @param violations      violation count after the check
 * @param blockApplied    penalty block started by this check, {@link Duration#ZERO} if none
 */
public record RateLimitDecision(
        boolean allowed,
        int tokensRemaining,
        Integer resetInSeconds,
        Reason reason,
        int violations,
        Duration blockApplied
) {

    public enum Reason {
        ALLOWED("allowed"),
        INSUFFICIENT_TOKENS("insufficient_tokens"),
        BLOCKED("blocked");

        private final String code;

        Reason(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    public RateLimitDecision {
        if (reason == null) {
            throw new IllegalArgumentException("reason must not be null");
        }
        if (allowed != (reason == Reason.ALLOWED)) {
            throw new IllegalArgumentException("reason %s does not match allowed=%s".formatted(reason, allowed));
        }
        if (allowed && resetInSeconds != null) {
            throw new IllegalArgumentException("an allowed decision has no reset time");
        }
        if (!allowed && (resetInSeconds == null || resetInSeconds < 1)) {
            throw new IllegalArgumentException("a denied decision needs resetInSeconds >= 1");
        }
        blockApplied = blockApplied == null ? Duration.ZERO : blockApplied;
    }

    public static RateLimitDecision allow(int tokensRemaining) {
        return new RateLimitDecision(true, tokensRemaining, null, Reason.ALLOWED, 0, Duration.ZERO);
    }

    public static RateLimitDecision blocked(int resetInSeconds, int violations) {
        return new RateLimitDecision(false, 0, resetInSeconds, Reason.BLOCKED, violations, Duration.ZERO);
    }

    public static RateLimitDecision insufficient(int tokensRemaining, int resetInSeconds, int violations,
                                                 Duration blockApplied) {
        return new RateLimitDecision(false, tokensRemaining, resetInSeconds, Reason.INSUFFICIENT_TOKENS,
                violations, blockApplied);
    }

    public OptionalInt resetIn() {
        return resetInSeconds == null ? OptionalInt.empty() : OptionalInt.of(resetInSeconds);
    }

    public boolean startedBlock() {
        return !blockApplied.isZero();
    }
}
