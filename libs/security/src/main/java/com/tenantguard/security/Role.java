package com.tenantguard.security;

import java.util.Optional;

/**
 * Account roles within a tenant, from most to least privileged.
 * <p>
 * Roles carry no hierarchy of their own; what each one may do is defined entirely by
 * {@link RolePermissions}.
 */
public enum Role {

    OWNER("owner"),
    ADMIN("admin"),
    MANAGER("manager"),
    USER("user"),
    VIEWER("viewer");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The canonical lowercase name stored with accounts. */
    public String value() {
        return value;
    }

    /**
     * Looks up a role by its canonical name, ignoring case.
     *
     * @return the matching role, or empty for an unknown name
     */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Role role : values()) {
            if (role.value.equalsIgnoreCase(value.strip())) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
