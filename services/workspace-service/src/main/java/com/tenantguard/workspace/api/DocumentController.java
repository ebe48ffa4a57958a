package com.tenantguard.workspace.api;

import com.tenantguard.guard.GuardedOperation;
import com.tenantguard.guard.OperationGuard;
import com.tenantguard.guard.TenantScope;
import com.tenantguard.security.NotFoundException;
import com.tenantguard.security.tenancy.Document;
import com.tenantguard.security.tenancy.TenantScopedAccessor;
import com.tenantguard.workspace.infrastructure.web.CallerIdentityExtractor;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * CRUD over the tenant-owned resource kinds. Every endpoint runs through the
 * {@link OperationGuard}; handlers only see the caller's tenant.
 *
 * <p>Operations are named {@code <family>.<action>.<kind>} for audit and metrics and are charged
 * against the family-wide bucket, e.g. {@code mutation.create.contracts} draws on
 * {@code mutation.create}.
 */
@RestController
@RequestMapping("/api/v1")
public class DocumentController {

    static final Set<String> KINDS = Set.of("contracts", "vendors");
    static final String UNKNOWN_KIND = "unknown";

    private final OperationGuard guard;

    public DocumentController(OperationGuard guard) {
        this.guard = guard;
    }

    @GetMapping("/{kind}")
    public List<Document> list(@PathVariable String kind, HttpServletRequest request) {
        return guard.execute(CallerIdentityExtractor.from(request),
                operation("query.list", "query.default", kind, "read"),
                scope -> documents(scope, kind).list());
    }

    @GetMapping("/{kind}/{id}")
    public Document get(@PathVariable String kind, @PathVariable String id, HttpServletRequest request) {
        return guard.execute(CallerIdentityExtractor.from(request),
                operation("query.get", "query.default", kind, "read"),
                scope -> documents(scope, kind).byId(id));
    }

    @PostMapping("/{kind}")
    public ResponseEntity<Document> create(@PathVariable String kind, @RequestBody Map<String, Object> body,
                                           HttpServletRequest request) {
        Document created = guard.execute(CallerIdentityExtractor.from(request),
                operation("mutation.create", "mutation.create", kind, "create"),
                scope -> {
                    TenantScopedAccessor accessor = documents(scope, kind);
                    return accessor.byId(accessor.insert(body));
                });
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PatchMapping("/{kind}/{id}")
    public Document update(@PathVariable String kind, @PathVariable String id,
                           @RequestBody Map<String, Object> patch, HttpServletRequest request) {
        return guard.execute(CallerIdentityExtractor.from(request),
                operation("mutation.update", "mutation.update", kind, "update"),
                scope -> documents(scope, kind).update(id, patch));
    }

    @DeleteMapping("/{kind}/{id}")
    public ResponseEntity<Void> delete(@PathVariable String kind, @PathVariable String id,
                                       HttpServletRequest request) {
        guard.execute(CallerIdentityExtractor.from(request),
                operation("mutation.delete", "mutation.delete", kind, "delete"),
                scope -> {
                    documents(scope, kind).delete(id);
                    return null;
                });
        return ResponseEntity.noContent().build();
    }

    /** Unknown kinds share one operation name so metric tags stay bounded; the handler rejects them. */
    private static GuardedOperation operation(String family, String bucket, String kind, String action) {
        if (!KINDS.contains(kind)) {
            return GuardedOperation.of(family + "." + UNKNOWN_KIND, null).chargedAs(bucket);
        }
        return GuardedOperation.of(family + "." + kind, kind + "." + action).chargedAs(bucket);
    }

    private static TenantScopedAccessor documents(TenantScope scope, String kind) {
        if (!KINDS.contains(kind)) {
            throw new NotFoundException("resource kind", kind);
        }
        return scope.documents(kind);
    }
}
