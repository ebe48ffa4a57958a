package com.tenantguard.quota;

import java.time.Instant;

/**
 * Quota state of one operation for one subject, as seen at a point in time.
 *
 * @param operation      operation name
 * @param currentTokens  tokens available now, including refill not yet persisted
 * @param maxTokens      bucket capacity
 * @param refillRate     tokens per minute
 * @param costPerRequest configured cost
 * @param resetInSeconds seconds until the bucket is full again, or until the block ends; 0 when full
 * @param blocked        whether a penalty block is active
 * @param blockedUntil   end of the active block, or {@code null}
 * @param violations     consecutive denials so far
 */
public record OperationQuotaStatus(
        String operation,
        int currentTokens,
        int maxTokens,
        int refillRate,
        int costPerRequest,
        int resetInSeconds,
        boolean blocked,
        Instant blockedUntil,
        int violations
) {
}
