package com.tenantguard.workspace.config;

import com.tenantguard.guard.OperationGuard;
import com.tenantguard.observability.MetricFactory;
import com.tenantguard.observability.SensitiveDataRedactor;
import com.tenantguard.observability.SpanHelper;
import com.tenantguard.quota.QuotaAdministration;
import com.tenantguard.quota.QuotaMetrics;
import com.tenantguard.quota.QuotaStatusService;
import com.tenantguard.quota.RetentionSweeper;
import com.tenantguard.quota.TokenBucketLimiter;
import com.tenantguard.quota.audit.AuditLogger;
import com.tenantguard.quota.audit.AuditSink;
import com.tenantguard.quota.audit.InMemoryAuditSink;
import com.tenantguard.quota.config.RateLimitConfigRegistry;
import com.tenantguard.quota.store.BucketStore;
import com.tenantguard.quota.store.InMemoryBucketStore;
import com.tenantguard.security.InMemoryAccountDirectory;
import com.tenantguard.security.SecurityContextResolver;
import com.tenantguard.security.tenancy.DocumentStore;
import com.tenantguard.security.tenancy.InMemoryDocumentStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the quota, security and guard libraries into the service.
 *
 * <p>Bucket and audit storage are in memory unless {@code tenantguard.database.enabled=true},
 * where the JDBC stores from {@code QuotaDatabaseConfig} take their place.
 */
@Configuration
public class GuardConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GuardConfiguration.class);

    static final String INSTRUMENTATION_SCOPE = "com.tenantguard.workspace";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, WorkspaceServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    @Bean
    public RateLimitConfigRegistry rateLimitConfigRegistry(QuotaProperties quota) {
        RateLimitConfigRegistry registry = RateLimitConfigRegistry.defaults().withOverrides(quota.operations());
        log.info("Rate limits configured for {} operations ({} overridden)", registry.size(), quota.operations().size());
        return registry;
    }

    @Bean
    @ConditionalOnProperty(prefix = "tenantguard.database", name = "enabled", havingValue = "false", matchIfMissing = true)
    public InMemoryBucketStore inMemoryBucketStore() {
        log.warn("Using in-memory rate limit buckets; state is lost on restart and not shared between instances");
        return new InMemoryBucketStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "tenantguard.database", name = "enabled", havingValue = "false", matchIfMissing = true)
    public InMemoryAuditSink inMemoryAuditSink() {
        return new InMemoryAuditSink();
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "tenantguard.quota", name = "audit-async", havingValue = "true")
    public ExecutorService quotaAuditExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "quota-audit");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public AuditLogger auditLogger(AuditSink sink, SensitiveDataRedactor redactor, Clock clock,
                                   @Qualifier("quotaAuditExecutor") ObjectProvider<ExecutorService> quotaAuditExecutor) {
        return new AuditLogger(sink, redactor, clock, quotaAuditExecutor.getIfAvailable());
    }

    @Bean
    public QuotaMetrics quotaMetrics(MetricFactory metrics) {
        return new QuotaMetrics(metrics);
    }

    @Bean
    public TokenBucketLimiter tokenBucketLimiter(RateLimitConfigRegistry registry, BucketStore store,
                                                 AuditLogger audit, QuotaMetrics metrics, Clock clock) {
        return new TokenBucketLimiter(registry, store, audit, metrics, clock);
    }

    @Bean
    public InMemoryAccountDirectory accountDirectory(AccountSeedProperties seed) {
        var directory = new InMemoryAccountDirectory(seed.toAccounts());
        log.info("Account directory seeded with {} accounts", directory.size());
        return directory;
    }

    @Bean
    public SecurityContextResolver securityContextResolver(InMemoryAccountDirectory accounts) {
        return new SecurityContextResolver(accounts);
    }

    @Bean
    public DocumentStore documentStore() {
        return new InMemoryDocumentStore();
    }

    @Bean
    public OperationGuard operationGuard(SecurityContextResolver resolver, TokenBucketLimiter limiter,
                                         DocumentStore documents, AuditLogger audit, MetricFactory metrics,
                                         SpanHelper spans) {
        return new OperationGuard(resolver, limiter, documents, audit, metrics, spans);
    }

    @Bean
    public QuotaStatusService quotaStatusService(RateLimitConfigRegistry registry, BucketStore store, Clock clock) {
        return new QuotaStatusService(registry, store, clock);
    }

    @Bean
    public QuotaAdministration quotaAdministration(RateLimitConfigRegistry registry, BucketStore store,
                                                   AuditLogger audit, QuotaMetrics metrics, Clock clock) {
        return new QuotaAdministration(registry, store, audit, metrics, clock);
    }

    @Bean
    public RetentionSweeper retentionSweeper(BucketStore store, AuditSink sink, QuotaMetrics metrics, Clock clock,
                                             QuotaProperties quota) {
        return new RetentionSweeper(store, sink, metrics, clock, quota.retention());
    }
}
