package com.tenantguard.workspace.api;

import com.tenantguard.guard.GuardedOperation;
import com.tenantguard.guard.OperationGuard;
import com.tenantguard.quota.QuotaAdministration;
import com.tenantguard.quota.QuotaStatus;
import com.tenantguard.quota.QuotaStatusService;
import com.tenantguard.quota.RateLimitSubject;
import com.tenantguard.security.Account;
import com.tenantguard.security.SecurityContextResolver;
import com.tenantguard.workspace.infrastructure.web.CallerIdentityExtractor;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Quota self-service and administration.
 */
@RestController
@RequestMapping("/api/v1/rate-limits")
public class RateLimitController {

    static final GuardedOperation STATUS =
            GuardedOperation.of("query.status.ratelimits", null).chargedAs("query.default");
    static final GuardedOperation RESET =
            GuardedOperation.of("mutation.reset.ratelimits", QuotaAdministration.RESET_PERMISSION)
                    .chargedAs("mutation.update");

    private final OperationGuard guard;
    private final QuotaStatusService statusService;
    private final QuotaAdministration administration;
    private final SecurityContextResolver resolver;

    public RateLimitController(OperationGuard guard, QuotaStatusService statusService,
                               QuotaAdministration administration, SecurityContextResolver resolver) {
        this.guard = guard;
        this.statusService = statusService;
        this.administration = administration;
        this.resolver = resolver;
    }

    /** The caller's own buckets, for every configured operation or just one. */
    @GetMapping("/status")
    public QuotaStatus status(@RequestParam(required = false) String operation, HttpServletRequest request) {
        return guard.execute(CallerIdentityExtractor.from(request), STATUS,
                scope -> statusService.statusOf(RateLimitSubject.forUser(scope.userId()),
                        Optional.ofNullable(operation).filter(op -> !op.isBlank())));
    }

    @PostMapping("/reset")
    public Map<String, Object> reset(@Valid @RequestBody ResetRequest body, HttpServletRequest request) {
        return guard.execute(CallerIdentityExtractor.from(request), RESET, scope -> {
            Account target = resolver.resolveTarget(scope.context(), body.userId());
            List<String> reset = administration.reset(scope.context(), target,
                    Optional.ofNullable(body.operation()).filter(op -> !op.isBlank()));
            return Map.<String, Object>of("userId", target.userId(), "operations", reset);
        });
    }
}
