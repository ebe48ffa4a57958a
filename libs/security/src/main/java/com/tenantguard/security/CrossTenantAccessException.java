package com.tenantguard.security;

/**
 * A caller addressed a resource that exists but belongs to another tenant.
 * <p>
 * The message names only the caller's own tenant so it can be logged without leaking the
 * owner; the owning tenant is kept in {@link #resourceTenantId()} for audit use.
 */
public class CrossTenantAccessException extends OperationRejectedException {

    private final String callerTenantId;
    private final String resourceTenantId;
    private final String resource;

    public CrossTenantAccessException(String callerTenantId, String resourceTenantId, String resource) {
        super(RejectionReason.CROSS_TENANT_ACCESS,
                "Access denied: %s is not visible to tenant '%s'".formatted(resource, callerTenantId));
        this.callerTenantId = callerTenantId;
        this.resourceTenantId = resourceTenantId;
        this.resource = resource;
    }

    public String callerTenantId() {
        return callerTenantId;
    }

    public String resourceTenantId() {
        return resourceTenantId;
    }

    /** Human-readable resource reference, e.g. {@code contracts/42}. */
    public String resource() {
        return resource;
    }
}
