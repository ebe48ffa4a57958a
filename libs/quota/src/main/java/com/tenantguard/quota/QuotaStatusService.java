package com.tenantguard.quota;

import com.tenantguard.quota.config.RateLimitConfig;
import com.tenantguard.quota.config.RateLimitConfigRegistry;
import com.tenantguard.quota.store.Bucket;
import com.tenantguard.quota.store.BucketStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a subject's buckets. Pending refill is computed but never written back.
 */
public class QuotaStatusService {

    private final RateLimitConfigRegistry registry;
    private final BucketStore store;
    private final Clock clock;

    public QuotaStatusService(RateLimitConfigRegistry registry, BucketStore store, Clock clock) {
        this.registry = registry;
        this.store = store;
        this.clock = clock;
    }

    /**
     * Status of one operation, or of every configured operation when {@code operation} is empty.
     */
    public QuotaStatus statusOf(RateLimitSubject subject, Optional<String> operation) {
        Instant now = clock.instant();
        Collection<String> operations = operation.<Collection<String>>map(op -> List.of(op)).orElseGet(registry::operations);
        var statuses = new ArrayList<OperationQuotaStatus>(operations.size());
        for (String op : operations) {
            statuses.add(statusOf(subject, op, now));
        }
        return new QuotaStatus(subject.identity(), statuses, now);
    }

    private OperationQuotaStatus statusOf(RateLimitSubject subject, String operation, Instant now) {
        RateLimitConfig config = registry.resolve(operation);
        Optional<Bucket> stored = store.find(subject.bucketKey(operation));
        if (stored.isEmpty()) {
            return new OperationQuotaStatus(operation, config.maxTokens(), config.maxTokens(),
                    config.refillRatePerMinute(), config.costPerRequest(), 0, false, null, 0);
        }

        Bucket bucket = stored.get();
        if (bucket.isBlockedAt(now)) {
            int resetIn = TokenArithmetic.ceilSeconds(Duration.between(now, bucket.blockedUntil()));
            return new OperationQuotaStatus(operation, bucket.tokens(), config.maxTokens(),
                    config.refillRatePerMinute(), config.costPerRequest(), resetIn, true,
                    bucket.blockedUntil(), bucket.violations());
        }

        int current = TokenArithmetic.refill(bucket, config, now).tokens();
        int resetIn = current < config.maxTokens()
                ? TokenArithmetic.secondsToRefill(config.maxTokens() - current, config)
                : 0;
        return new OperationQuotaStatus(operation, current, config.maxTokens(),
                config.refillRatePerMinute(), config.costPerRequest(), resetIn, false, null, bucket.violations());
    }
}
