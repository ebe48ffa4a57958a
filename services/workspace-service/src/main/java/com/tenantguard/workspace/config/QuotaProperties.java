package com.tenantguard.workspace.config;

import com.tenantguard.quota.RetentionSweeper;
import com.tenantguard.quota.config.RateLimitConfig;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Rate-limit tuning, bound from {@code tenantguard.quota.*}. Operation names contain dots, so
 * map keys are bracketed:
 *
 * <pre>
 * tenantguard:
 *   quota:
 *     audit-async: false
 *     retention: P30D
 *     sweep-interval: PT10M
 *     operations:
 *       "[mutation.create]":
 *         max-tokens: 40
 *         refill-rate-per-minute: 20
 *         cost-per-request: 2
 * </pre>
 *
 * @param operations    limits that replace or extend the built-in table
 * @param auditAsync    write audit records on a background thread
 * @param retention     how long audit records are kept
 * @param sweepInterval delay between retention sweeps
 */
@ConfigurationProperties(prefix = "tenantguard.quota")
@Validated
public record QuotaProperties(
        Map<String, RateLimitConfig> operations,
        boolean auditAsync,
        Duration retention,
        Duration sweepInterval) {

    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(10);

    public QuotaProperties {
        operations = operations == null ? Map.of() : Map.copyOf(operations);
        if (retention == null || retention.isZero() || retention.isNegative()) {
            retention = RetentionSweeper.DEFAULT_RETENTION;
        }
        if (sweepInterval == null || sweepInterval.isZero() || sweepInterval.isNegative()) {
            sweepInterval = DEFAULT_SWEEP_INTERVAL;
        }
    }
}
