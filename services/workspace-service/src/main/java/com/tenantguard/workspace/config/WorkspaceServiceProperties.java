package com.tenantguard.workspace.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity and presentation settings, bound from {@code tenantguard.service.*}:
 *
 * <pre>
 * tenantguard:
 *   service:
 *     name: workspace-service
 *     environment: production
 *     description: Contracts and vendors API
 *     cross-tenant-as-not-found: true
 * </pre>
 *
 * @param name                  service name used for logging and metric tags. Required.
 * @param environment           deployment environment (development, staging, production)
 * @param description           human-readable description for the info endpoint
 * @param crossTenantAsNotFound answer cross-tenant access with 404 instead of 403, so callers
 *                              cannot probe for ids owned by other tenants
 */
@ConfigurationProperties(prefix = "tenantguard.service")
@Validated
public record WorkspaceServiceProperties(
        @NotBlank String name,
        String environment,
        String description,
        @DefaultValue("true") boolean crossTenantAsNotFound) {

    public WorkspaceServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
