package com.tenantguard.security;

/**
 * The resolved role does not grant the requested {@code resource.action} permission.
 */
public class PermissionDeniedException extends OperationRejectedException {

    private final String permission;
    private final Role role;

    public PermissionDeniedException(String permission, Role role) {
        super(RejectionReason.PERMISSION_DENIED,
                "Permission denied: %s (role %s)".formatted(permission, role.value()));
        this.permission = permission;
        this.role = role;
    }

    public String permission() {
        return permission;
    }

    public Role role() {
        return role;
    }
}
