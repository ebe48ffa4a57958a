package com.tenantguard.quota;

import com.tenantguard.quota.audit.AuditLogger;
import com.tenantguard.quota.config.RateLimitConfig;
import com.tenantguard.quota.config.RateLimitConfigRegistry;
import com.tenantguard.quota.store.Bucket;
import com.tenantguard.quota.store.BucketStore;
import com.tenantguard.quota.store.BucketTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token-bucket rate limiter with escalating penalty blocks.
 * <p>
 * Each check runs as a single {@link BucketStore#modify} transition, so concurrent checks for
 * the same key never lose an update: with {@code M} tokens and cost {@code c}, at most
 * {@code floor(M / c)} requests succeed before a refill. Every decision is audited.
 */
public class TokenBucketLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketLimiter.class);

    private final RateLimitConfigRegistry registry;
    private final BucketStore store;
    private final AuditLogger audit;
    private final QuotaMetrics metrics;
    private final Clock clock;

    public TokenBucketLimiter(RateLimitConfigRegistry registry, BucketStore store, AuditLogger audit,
                              QuotaMetrics metrics, Clock clock) {
        this.registry = registry;
        this.store = store;
        this.audit = audit;
        this.metrics = metrics;
        this.clock = clock;
    }

    public RateLimitDecision check(RateLimitSubject subject, String operation) {
        return check(subject, operation, null);
    }

    /**
     * Charges {@code subject} for one request of {@code operation}.
     *
     * @param costOverride tokens to charge instead of the configured cost, or {@code null}
     * @throws IllegalArgumentException if {@code costOverride} is not positive
     */
    public RateLimitDecision check(RateLimitSubject subject, String operation, Integer costOverride) {
        if (costOverride != null && costOverride <= 0) {
            throw new IllegalArgumentException("costOverride must be positive, got " + costOverride);
        }
        RateLimitConfig config = registry.resolve(operation);
        int cost = costOverride != null ? costOverride : config.costPerRequest();
        if (subject.isDegraded()) {
            log.warn("Rate limiting operation={} against the shared '{}' bucket: caller has no identity or origin",
                    operation, subject.identity());
        }

        String key = subject.bucketKey(operation);
        Instant now = clock.instant();
        RateLimitDecision decision = store.modify(key,
                current -> evaluate(current.orElseGet(() -> Bucket.full(key, config.maxTokens(), now)),
                        config, cost, now));

        if (!decision.allowed()) {
            log.info("Rate limited identity={} operation={} reason={} violations={} resetIn={}s",
                    subject.identity(), operation, decision.reason().code(), decision.violations(),
                    decision.resetInSeconds());
        }
        metrics.recordDecision(operation, decision);
        audit.record(subject.identity(), operation, decision.allowed(), decision.tokensRemaining(),
                auditMetadata(decision, cost));
        return decision;
    }

    /**
     * Like {@link #check(RateLimitSubject, String, Integer)} but throws on denial.
     *
     * @throws RateLimitedException when the request is denied
     */
    public RateLimitDecision enforce(RateLimitSubject subject, String operation, Integer costOverride) {
        RateLimitDecision decision = check(subject, operation, costOverride);
        if (!decision.allowed()) {
            throw new RateLimitedException(operation, decision);
        }
        return decision;
    }

    static BucketTransition.Outcome<RateLimitDecision> evaluate(Bucket bucket, RateLimitConfig config,
                                                                int cost, Instant now) {
        if (bucket.isBlockedAt(now)) {
            int resetIn = TokenArithmetic.ceilSeconds(Duration.between(now, bucket.blockedUntil()));
            return new BucketTransition.Outcome<>(bucket, RateLimitDecision.blocked(resetIn, bucket.violations()));
        }

        Bucket refilled = TokenArithmetic.refill(bucket, config, now);
        if (refilled.tokens() >= cost) {
            Bucket consumed = refilled.consume(cost);
            return new BucketTransition.Outcome<>(consumed, RateLimitDecision.allow(consumed.tokens()));
        }

        int violations = refilled.violations() + 1;
        Duration block = ViolationEscalator.blockDurationFor(violations);
        Instant blockedUntil = block.isZero() ? null : now.plus(block);
        int resetIn = block.isZero()
                ? TokenArithmetic.secondsToRefill(cost - refilled.tokens(), config)
                : TokenArithmetic.ceilSeconds(block);
        return new BucketTransition.Outcome<>(
                refilled.withViolation(violations, blockedUntil),
                RateLimitDecision.insufficient(refilled.tokens(), resetIn, violations, block));
    }

    private static Map<String, Object> auditMetadata(RateLimitDecision decision, int cost) {
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("event", "rate_limit");
        metadata.put("reason", decision.reason().code());
        metadata.put("cost", cost);
        if (!decision.allowed()) {
            metadata.put("resetInSeconds", decision.resetInSeconds());
            metadata.put("violations", decision.violations());
        }
        if (decision.startedBlock()) {
            metadata.put("blockSeconds", decision.blockApplied().toSeconds());
        }
        return metadata;
    }
}
