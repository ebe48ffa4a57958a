package com.tenantguard.guard;

import com.tenantguard.observability.CorrelationContext;
import com.tenantguard.observability.CorrelationContextHolder;
import com.tenantguard.observability.MetricFactory;
import com.tenantguard.observability.SpanHelper;
import com.tenantguard.quota.RateLimitDecision;
import com.tenantguard.quota.RateLimitSubject;
import com.tenantguard.quota.TokenBucketLimiter;
import com.tenantguard.quota.audit.AuditLogger;
import com.tenantguard.security.CallerIdentity;
import com.tenantguard.security.CrossTenantAccessException;
import com.tenantguard.security.OperationRejectedException;
import com.tenantguard.security.PermissionChecker;
import com.tenantguard.security.PermissionDeniedException;
import com.tenantguard.security.SecurityContext;
import com.tenantguard.security.SecurityContextResolver;
import com.tenantguard.security.UnauthenticatedException;
import com.tenantguard.security.tenancy.DocumentStore;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single entry point for every query, mutation and action.
 * <p>
 * Steps run in a fixed order: resolve the caller, charge the rate limit, check the permission,
 * run the handler against a {@link TenantScope}, then audit the outcome. A step that fails
 * stops the pipeline, so a denied caller never reaches the handler. Rejections are rethrown
 * unchanged; any other runtime failure becomes an {@link InternalOperationException}.
 */
public class OperationGuard {

    private static final Logger log = LoggerFactory.getLogger(OperationGuard.class);

    public static final String OPERATIONS_METRIC = "tenantguard.operations";
    public static final String HANDLER_METRIC = "tenantguard.operations.handler";

    private final SecurityContextResolver resolver;
    private final TokenBucketLimiter limiter;
    private final DocumentStore documents;
    private final AuditLogger audit;
    private final MetricFactory metrics;
    private final SpanHelper spans;

    public OperationGuard(SecurityContextResolver resolver, TokenBucketLimiter limiter, DocumentStore documents,
                          AuditLogger audit, MetricFactory metrics, SpanHelper spans) {
        this.resolver = resolver;
        this.limiter = limiter;
        this.documents = documents;
        this.audit = audit;
        this.metrics = metrics;
        this.spans = spans;
    }

    /**
     * Runs {@code handler} for {@code caller} under the rules of {@code operation}.
     *
     * @throws OperationRejectedException  when the caller is refused at any step
     * @throws InternalOperationException  when anything else goes wrong
     */
    public <T> T execute(CallerIdentity caller, GuardedOperation operation, OperationHandler<T> handler) {
        SecurityContext context = resolve(caller, operation);
        CorrelationContextHolder.bindPrincipal(context.tenantId(), context.userId());
        RateLimitSubject subject = RateLimitSubject.forUser(context.userId());

        RateLimitDecision decision;
        try {
            decision = limiter.enforce(subject, operation.rateLimitOperation(), operation.costOverride());
        } catch (OperationRejectedException e) {
            finish(subject, operation, context, OperationOutcome.of(e.reason()), 0, details(e));
            throw e;
        } catch (RuntimeException e) {
            throw internalError(subject, operation, context, 0, e);
        }

        try {
            PermissionChecker.require(context, operation.permission());
        } catch (PermissionDeniedException e) {
            finish(subject, operation, context, OperationOutcome.PERMISSION_DENIED, decision.tokensRemaining(),
                    details(e));
            throw e;
        }

        T result;
        Timer.Sample sample = Timer.start(metrics.registry());
        try {
            result = spans.inSpan(operation.name(), Map.of("operation.permission", String.valueOf(operation.permission())),
                    () -> handler.handle(new TenantScope(documents, context)));
        } catch (OperationRejectedException e) {
            finish(subject, operation, context, OperationOutcome.of(e.reason()), decision.tokensRemaining(), details(e));
            throw e;
        } catch (RuntimeException e) {
            throw internalError(subject, operation, context, decision.tokensRemaining(), e);
        } finally {
            sample.stop(metrics.timer(HANDLER_METRIC, "Handler execution time", "operation", operation.name()));
        }

        finish(subject, operation, context, OperationOutcome.SUCCESS, decision.tokensRemaining(), Map.of());
        return result;
    }

    private SecurityContext resolve(CallerIdentity caller, GuardedOperation operation) {
        String origin = caller == null ? null : caller.networkOrigin();
        RateLimitSubject anonymous = RateLimitSubject.forOrigin(origin);
        try {
            return resolver.resolve(caller);
        } catch (UnauthenticatedException e) {
            int tokensRemaining = chargeAnonymous(anonymous, operation);
            finish(anonymous, operation, null, OperationOutcome.UNAUTHENTICATED, tokensRemaining, details(e));
            throw e;
        } catch (OperationRejectedException e) {
            finish(anonymous, operation, null, OperationOutcome.of(e.reason()), 0, details(e));
            throw e;
        } catch (RuntimeException e) {
            throw internalError(anonymous, operation, null, 0, e);
        }
    }

    /** Charges an unauthenticated call to its network origin bucket. */
    private int chargeAnonymous(RateLimitSubject anonymous, GuardedOperation operation) {
        try {
            return limiter.enforce(anonymous, operation.rateLimitOperation(), operation.costOverride())
                    .tokensRemaining();
        } catch (OperationRejectedException e) {
            finish(anonymous, operation, null, OperationOutcome.of(e.reason()), 0, details(e));
            throw e;
        } catch (RuntimeException e) {
            throw internalError(anonymous, operation, null, 0, e);
        }
    }

    private InternalOperationException internalError(RateLimitSubject subject, GuardedOperation operation,
                                                     SecurityContext context, int tokensRemaining,
                                                     RuntimeException e) {
        log.error("Operation {} failed for identity={}", operation.name(), subject.identity(), e);
        finish(subject, operation, context, OperationOutcome.INTERNAL_ERROR, tokensRemaining,
                Map.of("error", e.getClass().getName()));
        return new InternalOperationException(operation.name(), e);
    }

    private void finish(RateLimitSubject subject, GuardedOperation operation, SecurityContext context,
                        OperationOutcome outcome, int tokensRemaining, Map<String, Object> details) {
        metrics.counter(OPERATIONS_METRIC, "Guarded operations by outcome",
                "operation", operation.name(), "outcome", outcome.code()).increment();

        if (outcome != OperationOutcome.SUCCESS && outcome != OperationOutcome.INTERNAL_ERROR) {
            log.info("Operation {} rejected: outcome={} identity={}", operation.name(), outcome, subject.identity());
        }

        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("event", "outcome");
        metadata.put("outcome", outcome.name());
        if (context != null) {
            metadata.put("tenantId", context.tenantId());
            metadata.put("role", context.role().value());
        }
        CorrelationContextHolder.get()
                .map(CorrelationContext::correlationId)
                .ifPresent(id -> metadata.put("correlationId", id));
        metadata.putAll(details);
        audit.record(subject.identity(), operation.name(), outcome == OperationOutcome.SUCCESS, tokensRemaining,
                metadata);
    }

    private static Map<String, Object> details(OperationRejectedException e) {
        var details = new LinkedHashMap<String, Object>();
        details.put("reason", e.reason().code());
        if (e instanceof PermissionDeniedException denied) {
            details.put("permission", denied.permission());
        } else if (e instanceof CrossTenantAccessException crossTenant) {
            details.put("resource", crossTenant.resource());
            details.put("ownerTenantId", crossTenant.resourceTenantId());
        }
        return details;
    }
}
