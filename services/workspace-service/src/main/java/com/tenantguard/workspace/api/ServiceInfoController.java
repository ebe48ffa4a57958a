package com.tenantguard.workspace.api;

import com.tenantguard.quota.config.RateLimitConfigRegistry;
import com.tenantguard.workspace.config.WorkspaceServiceProperties;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated service info for operational checks.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final WorkspaceServiceProperties properties;
    private final RateLimitConfigRegistry rateLimits;

    public ServiceInfoController(WorkspaceServiceProperties properties, RateLimitConfigRegistry rateLimits) {
        this.properties = properties;
        this.rateLimits = rateLimits;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description() != null ? properties.description() : "",
                "status", "running",
                "rateLimitedOperations", rateLimits.size(),
                "timestamp", Instant.now().toString());
    }
}
