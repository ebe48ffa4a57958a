package com.tenantguard.quota.audit;

import java.time.Instant;

/**
 * Append-only destination for {@link AuditRecord}s.
 */
public interface AuditSink {

    void append(AuditRecord record);

    /**
     * Deletes records older than {@code cutoff}. Sinks without retention support keep everything.
     *
     * @return number of records deleted
     */
    default int purgeBefore(Instant cutoff) {
        return 0;
    }
}
