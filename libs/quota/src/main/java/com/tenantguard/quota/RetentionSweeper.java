package com.tenantguard.quota;

import com.tenantguard.quota.audit.AuditSink;
import com.tenantguard.quota.store.BucketStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Periodic housekeeping: lifts expired penalty blocks and drops audit records past retention.
 */
public class RetentionSweeper {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    public static final Duration DEFAULT_RETENTION = Duration.ofDays(30);

    /**
     * @param clearedBlocks      buckets whose expired block was cleared
     * @param purgedAuditRecords audit records deleted
     */
    public record SweepResult(int clearedBlocks, int purgedAuditRecords) {
    }

    private final BucketStore store;
    private final AuditSink auditSink;
    private final QuotaMetrics metrics;
    private final Clock clock;
    private final Duration retention;

    public RetentionSweeper(BucketStore store, AuditSink auditSink, QuotaMetrics metrics, Clock clock,
                            Duration retention) {
        if (retention == null || retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("retention must be positive");
        }
        this.store = store;
        this.auditSink = auditSink;
        this.metrics = metrics;
        this.clock = clock;
        this.retention = retention;
    }

    public SweepResult sweep() {
        Instant now = clock.instant();
        int cleared = store.clearExpiredBlocks(now);
        int purged = auditSink.purgeBefore(now.minus(retention));
        var result = new SweepResult(cleared, purged);
        metrics.recordSweep(result);
        log.info("Retention sweep cleared {} expired blocks and purged {} audit records", cleared, purged);
        return result;
    }
}
