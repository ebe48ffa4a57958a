package com.tenantguard.quota.store;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage for {@link Bucket} state shared by every request.
 */
public interface BucketStore {

    /**
     * Applies {@code transition} to the bucket under {@code key} atomically: no other
     * modification of the same key may interleave between the read and the write.
     *
     * @return the transition's result
     */
    <R> R modify(String key, BucketTransition<R> transition);

    /** Reads a bucket without modifying it. */
    Optional<Bucket> find(String key);

    /**
     * Clears every block that ended at or before {@code now} and resets its violations.
     *
     * @return number of buckets cleared
     */
    int clearExpiredBlocks(Instant now);
}
