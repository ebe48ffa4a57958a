package com.tenantguard.security;

import java.util.ArrayList;

/**
 * Checks that the parts of a {@link SecurityContext} are present and well-formed, collecting
 * every error rather than stopping at the first.
 */
public final class SecurityContextValidator {

    private SecurityContextValidator() {
        // utility class
    }

    /**
     * Validates the components a security context is built from.
     *
     * @return a {@link SecurityValidationResult} with any errors found
     */
    public static SecurityValidationResult validate(String userId, String tenantId, Role role, Capability capability) {
        var errors = new ArrayList<String>();

        if (isBlank(userId)) {
            errors.add("userId must not be null or blank");
        }
        if (isBlank(tenantId)) {
            errors.add("tenantId must not be null or blank");
        }
        if (role == null) {
            errors.add("role must not be null");
        }
        if (capability == null) {
            errors.add("capability must not be null");
        }

        return errors.isEmpty() ? SecurityValidationResult.ok() : SecurityValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
