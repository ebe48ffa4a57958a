package com.tenantguard.database.jdbc;

import com.tenantguard.quota.store.Bucket;
import com.tenantguard.quota.store.BucketStore;
import com.tenantguard.quota.store.BucketTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * {@link BucketStore} on the {@code rate_limit_bucket} table.
 * <p>
 * Each modification is one transaction that locks the row with {@code SELECT ... FOR UPDATE}
 * before applying the transition. Two requests creating the same missing bucket race on the
 * primary key; the loser gets a duplicate-key error and retries, this time finding the row.
 */
public class JdbcBucketStore implements BucketStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcBucketStore.class);

    static final int MAX_ATTEMPTS = 3;

    private static final String SELECT_FOR_UPDATE = """
            SELECT bucket_key, tokens, last_refill, violations, blocked_until
            FROM rate_limit_bucket
            WHERE bucket_key = ?
            FOR UPDATE""";

    private static final String SELECT = """
            SELECT bucket_key, tokens, last_refill, violations, blocked_until
            FROM rate_limit_bucket
            WHERE bucket_key = ?""";

    private static final String INSERT = """
            INSERT INTO rate_limit_bucket (bucket_key, tokens, last_refill, violations, blocked_until)
            VALUES (?, ?, ?, ?, ?)""";

    private static final String UPDATE = """
            UPDATE rate_limit_bucket
            SET tokens = ?, last_refill = ?, violations = ?, blocked_until = ?
            WHERE bucket_key = ?""";

    private static final String CLEAR_EXPIRED = """
            UPDATE rate_limit_bucket
            SET blocked_until = NULL, violations = 0
            WHERE blocked_until IS NOT NULL AND blocked_until <= ?""";

    private static final RowMapper<Bucket> BUCKET_MAPPER = JdbcBucketStore::mapBucket;

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;

    public JdbcBucketStore(JdbcTemplate jdbc, TransactionTemplate transactions) {
        this.jdbc = jdbc;
        this.transactions = transactions;
    }

    @Override
    public <R> R modify(String key, BucketTransition<R> transition) {
        for (int attempt = 1; ; attempt++) {
            try {
                return transactions.execute(status -> modifyLocked(key, transition));
            } catch (DuplicateKeyException e) {
                if (attempt >= MAX_ATTEMPTS) {
                    throw e;
                }
                log.debug("Concurrent creation of bucket {} (attempt {}), retrying", key, attempt);
            }
        }
    }

    private <R> R modifyLocked(String key, BucketTransition<R> transition) {
        List<Bucket> rows = jdbc.query(SELECT_FOR_UPDATE, BUCKET_MAPPER, key);
        Optional<Bucket> current = rows.stream().findFirst();

        BucketTransition.Outcome<R> outcome = transition.apply(current);
        Bucket next = outcome.bucket();
        if (!key.equals(next.key())) {
            throw new IllegalStateException("transition for '%s' returned bucket '%s'".formatted(key, next.key()));
        }

        if (current.isEmpty()) {
            jdbc.update(INSERT, key, next.tokens(), toDb(next.lastRefill()), next.violations(),
                    toDb(next.blockedUntil()));
        } else if (!current.get().equals(next)) {
            jdbc.update(UPDATE, next.tokens(), toDb(next.lastRefill()), next.violations(),
                    toDb(next.blockedUntil()), key);
        }
        return outcome.result();
    }

    @Override
    public Optional<Bucket> find(String key) {
        return jdbc.query(SELECT, BUCKET_MAPPER, key).stream().findFirst();
    }

    @Override
    public int clearExpiredBlocks(Instant now) {
        return jdbc.update(CLEAR_EXPIRED, toDb(now));
    }

    private static Bucket mapBucket(ResultSet rs, int rowNum) throws SQLException {
        return new Bucket(
                rs.getString("bucket_key"),
                rs.getInt("tokens"),
                fromDb(rs.getObject("last_refill", OffsetDateTime.class)),
                rs.getInt("violations"),
                fromDb(rs.getObject("blocked_until", OffsetDateTime.class)));
    }

    static OffsetDateTime toDb(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    static Instant fromDb(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }
}
