package com.tenantguard.quota.audit;

import com.tenantguard.observability.SensitiveDataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Best-effort writer in front of an {@link AuditSink}.
 * <p>
 * Failures are logged at WARN and never reach the caller. Metadata is redacted before it is
 * stored. With an executor, writes are dispatched asynchronously; the executor must run tasks
 * in submission order (e.g. a single-thread executor) so a request's records keep their order.
 */
public class AuditLogger {

    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final AuditSink sink;
    private final SensitiveDataRedactor redactor;
    private final Clock clock;
    private final Executor executor;

    /** Writes synchronously on the calling thread. */
    public AuditLogger(AuditSink sink, SensitiveDataRedactor redactor, Clock clock) {
        this(sink, redactor, clock, null);
    }

    /**
     * @param executor order-preserving executor, or {@code null} to write on the calling thread
     */
    public AuditLogger(AuditSink sink, SensitiveDataRedactor redactor, Clock clock, Executor executor) {
        if (sink == null || redactor == null || clock == null) {
            throw new IllegalArgumentException("sink, redactor and clock are required");
        }
        this.sink = sink;
        this.redactor = redactor;
        this.clock = clock;
        this.executor = executor;
    }

    /**
     * Records one decision. Never throws.
     */
    public void record(String identity, String operationTag, boolean allowed, int tokensRemaining,
                       Map<String, ?> metadata) {
        AuditRecord record;
        try {
            record = new AuditRecord(identity, operationTag, allowed, tokensRemaining,
                    clock.instant(), redactor.redact(metadata));
        } catch (RuntimeException e) {
            log.warn("Dropping malformed audit record for operation={}: {}", operationTag, e.getMessage());
            return;
        }

        if (executor == null) {
            write(record);
            return;
        }
        try {
            executor.execute(() -> write(record));
        } catch (RejectedExecutionException e) {
            log.warn("Audit executor rejected record for operation={}, writing inline", operationTag);
            write(record);
        }
    }

    private void write(AuditRecord record) {
        try {
            sink.append(record);
        } catch (RuntimeException e) {
            log.warn("Audit write failed for operation={} identity={}: {}",
                    record.operationTag(), record.identity(), e.getMessage(), e);
        }
    }
}
