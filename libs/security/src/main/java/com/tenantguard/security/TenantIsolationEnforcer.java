package com.tenantguard.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares the caller's tenant against the tenant that owns a resource.
 */
public final class TenantIsolationEnforcer {

    private static final Logger log = LoggerFactory.getLogger(TenantIsolationEnforcer.class);

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * Passes silently when the tenants match.
     *
     * @param context          the caller
     * @param resourceTenantId tenant owning the resource
     * @param resource         resource reference for logs and the exception, e.g. {@code contracts/42}
     * @throws CrossTenantAccessException if the tenants differ
     */
    public static void enforce(SecurityContext context, String resourceTenantId, String resource) {
        if (!context.tenantId().equals(resourceTenantId)) {
            log.warn("Cross-tenant access blocked: userId={} tenantId={} resource={} ownerTenant={}",
                    context.userId(), context.tenantId(), resource, resourceTenantId);
            throw new CrossTenantAccessException(context.tenantId(), resourceTenantId, resource);
        }
    }
}
