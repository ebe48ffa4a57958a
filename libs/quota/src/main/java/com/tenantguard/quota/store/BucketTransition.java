package com.tenantguard.quota.store;

import java.util.Optional;

/**
 * A read-modify-write step applied to one bucket under the store's per-key atomicity.
 * <p>
 * Implementations must be free of side effects other than computing the outcome: a store may
 * invoke a transition more than once when it retries.
 *
 * @param <R> result handed back to the caller of {@link BucketStore#modify}
 */
@FunctionalInterface
public interface BucketTransition<R> {

    /**
     * @param current the stored bucket, or empty on first use
     * @return the bucket to store and the caller's result
     */
    Outcome<R> apply(Optional<Bucket> current);

    /**
     * @param bucket new state to store, with the same key as the one being modified
     * @param result value returned from {@link BucketStore#modify}
     */
    record Outcome<R>(Bucket bucket, R result) {

        public Outcome {
            if (bucket == null) {
                throw new IllegalArgumentException("bucket must not be null");
            }
        }
    }
}
