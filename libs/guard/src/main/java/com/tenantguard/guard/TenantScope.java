package com.tenantguard.guard;

import com.tenantguard.security.SecurityContext;
import com.tenantguard.security.tenancy.DocumentStore;
import com.tenantguard.security.tenancy.TenantScopedAccessor;

/**
 * What a handler may touch: the caller's context and tenant-scoped accessors. Raw storage is
 * not reachable from here.
 */
public final class TenantScope {

    private final DocumentStore store;
    private final SecurityContext context;

    TenantScope(DocumentStore store, SecurityContext context) {
        this.store = store;
        this.context = context;
    }

    /** An accessor for {@code kind} bound to the caller's tenant. */
    public TenantScopedAccessor documents(String kind) {
        return new TenantScopedAccessor(store, kind, context);
    }

    public SecurityContext context() {
        return context;
    }

    public String tenantId() {
        return context.tenantId();
    }

    public String userId() {
        return context.userId();
    }
}
