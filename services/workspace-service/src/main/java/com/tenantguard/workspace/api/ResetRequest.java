package com.tenantguard.workspace.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /api/v1/rate-limits/reset}.
 *
 * @param userId    user whose buckets are reset; must belong to the caller's tenant
 * @param operation single operation to reset, or {@code null} for all configured operations
 */
public record ResetRequest(@NotBlank String userId, String operation) {
}
