package com.tenantguard.security.testing;

import com.tenantguard.security.Account;
import com.tenantguard.security.Role;
import com.tenantguard.security.SecurityContext;

/**
 * Ready-made {@link SecurityContext} and {@link Account} values for tests.
 * <p>
 * Lives in the main source set so other modules can use it from their test scope through a
 * regular Maven dependency.
 */
public final class TestSecurityContextFactory {

    public static final String DEFAULT_USER = "test-user-001";
    public static final String DEFAULT_TENANT = "test-tenant-001";

    private TestSecurityContextFactory() {
        // utility class
    }

    /** A USER in the default tenant. */
    public static SecurityContext create() {
        return create(DEFAULT_USER, DEFAULT_TENANT, Role.USER);
    }

    public static SecurityContext createWithRole(Role role) {
        return create(DEFAULT_USER, DEFAULT_TENANT, role);
    }

    public static SecurityContext createForTenant(String tenantId) {
        return create(DEFAULT_USER, tenantId, Role.USER);
    }

    public static SecurityContext create(String userId, String tenantId, Role role) {
        return SecurityContext.forRole(userId, tenantId, role);
    }

    /** An active account whose subject is {@code "sub-" + userId}. */
    public static Account account(String userId, String tenantId, Role role) {
        return new Account(userId, tenantId, "sub-" + userId, role, true);
    }

    public static Account inactiveAccount(String userId, String tenantId, Role role) {
        return new Account(userId, tenantId, "sub-" + userId, role, false);
    }
}
