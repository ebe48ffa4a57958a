package com.tenantguard.security;

/**
 * Resolved caller for one request. Built fresh by {@link SecurityContextResolver} on every call
 * and passed explicitly; never stored in a thread-local or cache, so a role change takes effect
 * on the next request.
 *
 * @param userId     account id of the caller
 * @param tenantId   tenant every data access is scoped to
 * @param role       account role
 * @param capability permissions granted by the role
 */
public record SecurityContext(String userId, String tenantId, Role role, Capability capability) {

    public SecurityContext {
        SecurityValidationResult result = SecurityContextValidator.validate(userId, tenantId, role, capability);
        if (!result.valid()) {
            throw new IllegalArgumentException("Invalid security context: " + String.join(", ", result.errors()));
        }
    }

    /**
     * Builds a context whose capability is looked up from {@link RolePermissions}.
     */
    public static SecurityContext forRole(String userId, String tenantId, Role role) {
        return new SecurityContext(userId, tenantId, role, RolePermissions.capabilityOf(role));
    }
}
