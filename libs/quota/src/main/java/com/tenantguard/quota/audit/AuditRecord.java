package com.tenantguard.quota.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One write-once audit entry for an allow or deny decision.
 *
 * @param identity        {@code kind:value} of the subject, or {@code null} when unknown
 * @param operationTag    operation name
 * @param allowed         whether the request went ahead
 * @param tokensRemaining tokens left in the subject's bucket at decision time
 * @param timestamp       decision time
 * @param metadata        redacted details such as the denial reason
 */
public record AuditRecord(
        String identity,
        String operationTag,
        boolean allowed,
        int tokensRemaining,
        Instant timestamp,
        Map<String, Object> metadata
) {

    public AuditRecord {
        if (operationTag == null || operationTag.isBlank()) {
            throw new IllegalArgumentException("operationTag must not be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
