package com.tenantguard.security;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Static role to capability map. Total over {@link Role}: the class fails to initialise if a
 * role is added without an entry.
 */
public final class RolePermissions {

    private static final Map<Role, Capability> CAPABILITIES;

    static {
        Map<Role, Capability> map = new EnumMap<>(Role.class);
        map.put(Role.OWNER, Capability.all());
        map.put(Role.ADMIN, Capability.of(
                "contracts.create", "contracts.read", "contracts.update", "contracts.delete",
                "vendors.create", "vendors.read", "vendors.update", "vendors.delete",
                "users.read", "users.update", "users.invite",
                "analytics.read", "settings.read", "settings.update",
                "ratelimits.read", "ratelimits.reset"));
        map.put(Role.MANAGER, Capability.of(
                "contracts.create", "contracts.read", "contracts.update",
                "vendors.create", "vendors.read", "vendors.update",
                "users.read", "analytics.read"));
        map.put(Role.USER, Capability.of(
                "contracts.create", "contracts.read", "contracts.update",
                "vendors.create", "vendors.read", "vendors.update",
                "analytics.read"));
        map.put(Role.VIEWER, Capability.of(
                "contracts.read", "vendors.read", "users.read", "analytics.read"));

        for (Role role : Role.values()) {
            if (!map.containsKey(role)) {
                throw new IllegalStateException("No capability defined for role " + role);
            }
        }
        CAPABILITIES = Collections.unmodifiableMap(map);
    }

    private RolePermissions() {
        // utility class
    }

    public static Capability capabilityOf(Role role) {
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        return CAPABILITIES.get(role);
    }
}
