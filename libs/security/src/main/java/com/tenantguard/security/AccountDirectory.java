package com.tenantguard.security;

import java.util.Optional;

/**
 * Lookup of application accounts. Implementations are read on every request; results must not
 * be cached by callers.
 */
public interface AccountDirectory {

    /** The account linked to an identity-provider subject. */
    Optional<Account> findBySubject(String subject);

    /** The account with the given application user id. */
    Optional<Account> findByUserId(String userId);
}
