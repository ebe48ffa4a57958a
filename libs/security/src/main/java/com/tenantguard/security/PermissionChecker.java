package com.tenantguard.security;

/**
 * Permission checks against a {@link SecurityContext}.
 */
public final class PermissionChecker {

    private PermissionChecker() {
        // utility class
    }

    /**
     * True when the context holds {@link Capability.All} or contains {@code permission} exactly.
     */
    public static boolean hasPermission(SecurityContext context, String permission) {
        return context.capability().grants(permission);
    }

    /**
     * Throws unless the context has {@code permission}. A {@code null} permission means the
     * operation requires none.
     *
     * @throws PermissionDeniedException if the permission is missing
     */
    public static void require(SecurityContext context, String permission) {
        if (permission != null && !hasPermission(context, permission)) {
            throw new PermissionDeniedException(permission, context.role());
        }
    }
}
