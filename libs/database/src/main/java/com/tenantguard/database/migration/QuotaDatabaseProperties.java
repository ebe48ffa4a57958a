package com.tenantguard.database.migration;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection and migration settings for the quota database.
 *
 * <pre>{@code
 * tenantguard:
 *   database:
 *     enabled: true
 *     url: jdbc:postgresql://localhost:5432/tenantguard
 *     username: tenantguard
 *     password: secret
 *     locations: classpath:db/migration/quota
 * }</pre>
 *
 * @param url       JDBC URL
 * @param username  database user
 * @param password  database password
 * @param locations Flyway migration locations
 * @param enabled   whether the JDBC stores replace the in-memory ones
 */
@Validated
@ConfigurationProperties(prefix = "tenantguard.database")
public record QuotaDatabaseProperties(
        @NotBlank String url,
        @NotBlank String username,
        String password,
        String locations,
        boolean enabled) {

    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/quota";

    public QuotaDatabaseProperties {
        if (locations == null || locations.isBlank()) {
            locations = DEFAULT_LOCATIONS;
        }
    }
}
