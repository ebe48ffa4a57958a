package com.tenantguard.security;

/**
 * An application account as held by the {@link AccountDirectory}.
 *
 * @param userId   account id, used as the rate-limit identity
 * @param tenantId owning tenant
 * @param subject  identity-provider subject this account is linked to
 * @param role     role within the tenant
 * @param active   whether the account may sign in
 */
public record Account(String userId, String tenantId, String subject, Role role, boolean active) {

    public Account {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
    }
}
