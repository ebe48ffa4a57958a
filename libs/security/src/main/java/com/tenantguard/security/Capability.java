package com.tenantguard.security;

import java.util.Set;

/**
 * What a security context is allowed to do: either every permission, or an explicit finite set
 * of {@code resource.action} strings.
 * <p>
 * {@link Specific} does exact membership only. A stored permission such as {@code "*"} or
 * {@code "contracts.*"} is just an opaque string and grants nothing beyond itself.
 */
public sealed interface Capability permits Capability.All, Capability.Specific {

    /**
     * Whether this capability includes {@code permission}.
     */
    boolean grants(String permission);

    static Capability all() {
        return All.INSTANCE;
    }

    static Capability of(String... permissions) {
        return new Specific(Set.of(permissions));
    }

    /** Every permission. */
    final class All implements Capability {

        private static final All INSTANCE = new All();

        private All() {
        }

        @Override
        public boolean grants(String permission) {
            return true;
        }

        @Override
        public String toString() {
            return "Capability.All";
        }
    }

    /**
     * An explicit permission set.
     *
     * @param permissions granted permissions; the set is copied
     */
    record Specific(Set<String> permissions) implements Capability {

        public Specific {
            if (permissions == null) {
                throw new IllegalArgumentException("permissions must not be null");
            }
            permissions = Set.copyOf(permissions);
        }

        @Override
        public boolean grants(String permission) {
            return permission != null && permissions.contains(permission);
        }
    }
}
