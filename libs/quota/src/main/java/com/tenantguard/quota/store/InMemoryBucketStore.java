package com.tenantguard.quota.store;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link BucketStore} for a single process. Per-key atomicity comes from
 * {@link ConcurrentHashMap#compute}, which serializes writers of the same key while leaving
 * other keys unaffected.
 */
public class InMemoryBucketStore implements BucketStore {

    private final ConcurrentMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    @Override
    public <R> R modify(String key, BucketTransition<R> transition) {
        AtomicReference<R> result = new AtomicReference<>();
        buckets.compute(key, (k, current) -> {
            BucketTransition.Outcome<R> outcome = transition.apply(Optional.ofNullable(current));
            if (!k.equals(outcome.bucket().key())) {
                throw new IllegalStateException(
                        "transition for '%s' returned bucket '%s'".formatted(k, outcome.bucket().key()));
            }
            result.set(outcome.result());
            return outcome.bucket();
        });
        return result.get();
    }

    @Override
    public Optional<Bucket> find(String key) {
        return Optional.ofNullable(buckets.get(key));
    }

    @Override
    public int clearExpiredBlocks(Instant now) {
        AtomicInteger cleared = new AtomicInteger();
        for (String key : buckets.keySet()) {
            buckets.computeIfPresent(key, (k, bucket) -> {
                if (bucket.hasExpiredBlockAt(now)) {
                    cleared.incrementAndGet();
                    return bucket.unblocked();
                }
                return bucket;
            });
        }
        return cleared.get();
    }

    public int size() {
        return buckets.size();
    }
}
