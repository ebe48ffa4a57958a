package com.tenantguard.database.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantguard.quota.audit.AuditRecord;
import com.tenantguard.quota.audit.AuditSink;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;

/**
 * {@link AuditSink} on the {@code rate_limit_audit} table. Metadata is stored as JSON text.
 */
public class JdbcAuditSink implements AuditSink {

    private static final String INSERT = """
            INSERT INTO rate_limit_audit
                (subject_identity, operation_tag, allowed, tokens_remaining, occurred_at, metadata)
            VALUES (?, ?, ?, ?, ?, ?)""";

    private static final String PURGE = "DELETE FROM rate_limit_audit WHERE occurred_at < ?";

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public JdbcAuditSink(JdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    @Override
    public void append(AuditRecord record) {
        jdbc.update(INSERT,
                record.identity(),
                record.operationTag(),
                record.allowed(),
                record.tokensRemaining(),
                JdbcBucketStore.toDb(record.timestamp()),
                toJson(record));
    }

    @Override
    public int purgeBefore(Instant cutoff) {
        return jdbc.update(PURGE, JdbcBucketStore.toDb(cutoff));
    }

    private String toJson(AuditRecord record) {
        if (record.metadata().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(record.metadata());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Audit metadata for operation '%s' is not serializable".formatted(record.operationTag()), e);
        }
    }
}
