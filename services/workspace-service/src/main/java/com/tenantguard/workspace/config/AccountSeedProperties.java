package com.tenantguard.workspace.config;

import com.tenantguard.security.Account;
import com.tenantguard.security.Role;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Accounts loaded into the in-memory directory at startup, bound from
 * {@code tenantguard.accounts[*]}.
 *
 * @param accounts seed entries; empty when none are configured
 */
@ConfigurationProperties(prefix = "tenantguard")
@Validated
public record AccountSeedProperties(@Valid List<SeedAccount> accounts) {

    public AccountSeedProperties {
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
    }

    /**
     * @param userId   internal user id
     * @param tenantId owning tenant
     * @param subject  identity-provider subject the caller authenticates as
     * @param role     role name, case-insensitive
     * @param active   defaults to {@code true}
     */
    public record SeedAccount(
            @NotBlank String userId,
            @NotBlank String tenantId,
            @NotBlank String subject,
            @NotBlank String role,
            Boolean active) {

        public Account toAccount() {
            Role parsed = Role.fromString(role)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown role '%s' for account %s".formatted(role, userId)));
            return new Account(userId, tenantId, subject, parsed, active == null || active);
        }
    }

    public List<Account> toAccounts() {
        return accounts.stream().map(SeedAccount::toAccount).toList();
    }
}
