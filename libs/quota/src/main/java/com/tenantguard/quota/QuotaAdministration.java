package com.tenantguard.quota;

import com.tenantguard.quota.audit.AuditLogger;
import com.tenantguard.quota.config.RateLimitConfig;
import com.tenantguard.quota.config.RateLimitConfigRegistry;
import com.tenantguard.quota.store.Bucket;
import com.tenantguard.quota.store.BucketStore;
import com.tenantguard.quota.store.BucketTransition;
import com.tenantguard.security.Account;
import com.tenantguard.security.PermissionChecker;
import com.tenantguard.security.SecurityContext;
import com.tenantguard.security.TenantIsolationEnforcer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Administrative reset of a user's buckets within the administrator's own tenant.
 */
public class QuotaAdministration {

    private static final Logger log = LoggerFactory.getLogger(QuotaAdministration.class);

    public static final String RESET_PERMISSION = "ratelimits.reset";

    private final RateLimitConfigRegistry registry;
    private final BucketStore store;
    private final AuditLogger audit;
    private final QuotaMetrics metrics;
    private final Clock clock;

    public QuotaAdministration(RateLimitConfigRegistry registry, BucketStore store, AuditLogger audit,
                               QuotaMetrics metrics, Clock clock) {
        this.registry = registry;
        this.store = store;
        this.audit = audit;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Restores {@code target}'s bucket for {@code operation} (or every configured operation when
     * empty) to full, with no violations and no block.
     *
     * @return the operations that were reset
     * @throws com.tenantguard.security.PermissionDeniedException  without {@value #RESET_PERMISSION}
     * @throws com.tenantguard.security.CrossTenantAccessException when the target is in another tenant
     */
    public List<String> reset(SecurityContext actor, Account target, Optional<String> operation) {
        PermissionChecker.require(actor, RESET_PERMISSION);
        TenantIsolationEnforcer.enforce(actor, target.tenantId(), "users/" + target.userId());

        RateLimitSubject subject = RateLimitSubject.forUser(target.userId());
        Collection<String> operations = operation.<Collection<String>>map(op -> List.of(op)).orElseGet(registry::operations);
        Instant now = clock.instant();
        var reset = new ArrayList<String>(operations.size());
        for (String op : operations) {
            RateLimitConfig config = registry.resolve(op);
            String key = subject.bucketKey(op);
            Bucket restored = store.modify(key, current -> {
                Bucket full = Bucket.full(key, config.maxTokens(), now);
                return new BucketTransition.Outcome<>(full, full);
            });
            reset.add(op);
            metrics.recordReset(op);
            audit.record(subject.identity(), op, true, restored.tokens(), Map.of(
                    "event", "admin_reset",
                    "actorUserId", actor.userId(),
                    "tenantId", actor.tenantId()));
        }
        log.info("Rate limits reset by userId={} for userId={} operations={}",
                actor.userId(), target.userId(), reset);
        return reset;
    }
}
