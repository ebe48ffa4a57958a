package com.tenantguard.quota;

import com.tenantguard.observability.MetricFactory;

/**
 * Micrometer counters for limiter activity, tagged by operation and outcome.
 */
public class QuotaMetrics {

    public static final String DECISIONS = "tenantguard.ratelimit.decisions";
    public static final String RESETS = "tenantguard.ratelimit.resets";
    public static final String SWEPT_BLOCKS = "tenantguard.ratelimit.swept.blocks";
    public static final String PURGED_AUDIT = "tenantguard.ratelimit.purged.audit";

    private final MetricFactory metrics;

    public QuotaMetrics(MetricFactory metrics) {
        this.metrics = metrics;
    }

    public void recordDecision(String operation, RateLimitDecision decision) {
        metrics.counter(DECISIONS, "Rate limit decisions",
                "operation", operation,
                "outcome", decision.reason().code()).increment();
    }

    public void recordReset(String operation) {
        metrics.counter(RESETS, "Administrative bucket resets", "operation", operation).increment();
    }

    public void recordSweep(RetentionSweeper.SweepResult result) {
        metrics.counter(SWEPT_BLOCKS, "Expired penalty blocks cleared").increment(result.clearedBlocks());
        metrics.counter(PURGED_AUDIT, "Audit records purged by retention").increment(result.purgedAuditRecords());
    }
}
