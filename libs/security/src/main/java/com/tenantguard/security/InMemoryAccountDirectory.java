package com.tenantguard.security;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe in-memory {@link AccountDirectory}. Accounts can be replaced at runtime, which is
 * how role changes and deactivations are applied.
 */
public class InMemoryAccountDirectory implements AccountDirectory {

    private final ConcurrentMap<String, Account> bySubject = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Account> byUserId = new ConcurrentHashMap<>();

    public InMemoryAccountDirectory() {
    }

    public InMemoryAccountDirectory(Collection<Account> accounts) {
        accounts.forEach(this::put);
    }

    /**
     * Adds or replaces an account, keyed by both subject and user id.
     */
    public synchronized void put(Account account) {
        Account previous = byUserId.put(account.userId(), account);
        if (previous != null && !previous.subject().equals(account.subject())) {
            bySubject.remove(previous.subject());
        }
        bySubject.put(account.subject(), account);
    }

    public synchronized void remove(String userId) {
        Account removed = byUserId.remove(userId);
        if (removed != null) {
            bySubject.remove(removed.subject());
        }
    }

    @Override
    public Optional<Account> findBySubject(String subject) {
        return subject == null ? Optional.empty() : Optional.ofNullable(bySubject.get(subject));
    }

    @Override
    public Optional<Account> findByUserId(String userId) {
        return userId == null ? Optional.empty() : Optional.ofNullable(byUserId.get(userId));
    }

    public int size() {
        return byUserId.size();
    }
}
