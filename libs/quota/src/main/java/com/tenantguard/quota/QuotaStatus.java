package com.tenantguard.quota;

import java.time.Instant;
import java.util.List;

/**
 * @param identity   {@code kind:value} of the subject
 * @param operations one entry per requested operation
 * @param timestamp  when the projection was computed
 */
public record QuotaStatus(String identity, List<OperationQuotaStatus> operations, Instant timestamp) {

    public QuotaStatus {
        operations = List.copyOf(operations);
    }
}
