package com.tenantguard.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an upstream {@link CallerIdentity} into a fresh {@link SecurityContext}.
 * <p>
 * The account is looked up on every call; contexts are never cached, so deactivations and role
 * changes apply to the very next request.
 */
public class SecurityContextResolver {

    private static final Logger log = LoggerFactory.getLogger(SecurityContextResolver.class);

    private final AccountDirectory accounts;

    public SecurityContextResolver(AccountDirectory accounts) {
        if (accounts == null) {
            throw new IllegalArgumentException("accounts must not be null");
        }
        this.accounts = accounts;
    }

    /**
     * Resolves the caller.
     *
     * @throws UnauthenticatedException  when there is no identity or no account for it
     * @throws AccountInactiveException  when the account is disabled
     */
    public SecurityContext resolve(CallerIdentity identity) {
        if (identity == null || identity.subject() == null) {
            throw new UnauthenticatedException("Authentication required");
        }

        Account account = accounts.findBySubject(identity.subject())
                .orElseThrow(() -> {
                    log.debug("No account linked to subject {}", identity.subject());
                    return new UnauthenticatedException("No account for the authenticated identity");
                });

        if (!account.active()) {
            log.info("Rejected inactive account userId={} tenantId={}", account.userId(), account.tenantId());
            throw new AccountInactiveException(account.userId());
        }

        return SecurityContext.forRole(account.userId(), account.tenantId(), account.role());
    }

    /**
     * Resolves the account that an administrative operation targets. The target must exist and
     * belong to the caller's tenant.
     *
     * @throws NotFoundException            when no such account exists
     * @throws CrossTenantAccessException   when it belongs to another tenant
     */
    public Account resolveTarget(SecurityContext caller, String targetUserId) {
        Account target = accounts.findByUserId(targetUserId)
                .orElseThrow(() -> new NotFoundException("users", targetUserId));
        TenantIsolationEnforcer.enforce(caller, target.tenantId(), "users/" + targetUserId);
        return target;
    }
}
