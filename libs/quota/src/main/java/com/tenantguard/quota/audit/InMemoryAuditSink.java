package com.tenantguard.quota.audit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link AuditSink} keeping records in insertion order.
 */
public class InMemoryAuditSink implements AuditSink {

    private final List<AuditRecord> records = new ArrayList<>();

    @Override
    public synchronized void append(AuditRecord record) {
        records.add(record);
    }

    @Override
    public synchronized int purgeBefore(Instant cutoff) {
        int before = records.size();
        records.removeIf(r -> r.timestamp().isBefore(cutoff));
        return before - records.size();
    }

    /** Snapshot of every record so far. */
    public synchronized List<AuditRecord> records() {
        return List.copyOf(records);
    }

    public synchronized List<AuditRecord> recordsFor(String operationTag) {
        return records.stream().filter(r -> r.operationTag().equals(operationTag)).toList();
    }
}
