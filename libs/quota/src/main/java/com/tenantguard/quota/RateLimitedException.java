package com.tenantguard.quota;

import com.tenantguard.security.OperationRejectedException;
import com.tenantguard.security.RejectionReason;

/**
 * The caller exhausted its quota for an operation or is serving a penalty block. Retryable, but
 * only after {@link #resetInSeconds()}.
 */
public class RateLimitedException extends OperationRejectedException {

    private final String operation;
    private final int resetInSeconds;
    private final RateLimitDecision.Reason decisionReason;

    public RateLimitedException(String operation, RateLimitDecision decision) {
        super(RejectionReason.RATE_LIMITED,
                "Rate limit exceeded for '%s'. Retry in %d seconds".formatted(operation, decision.resetInSeconds()));
        if (decision.allowed()) {
            throw new IllegalArgumentException("decision was allowed");
        }
        this.operation = operation;
        this.resetInSeconds = decision.resetInSeconds();
        this.decisionReason = decision.reason();
    }

    public String operation() {
        return operation;
    }

    public int resetInSeconds() {
        return resetInSeconds;
    }

    /** {@code BLOCKED} while a penalty block is active, else {@code INSUFFICIENT_TOKENS}. */
    public RateLimitDecision.Reason decisionReason() {
        return decisionReason;
    }
}
