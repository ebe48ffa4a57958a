package com.tenantguard.guard;

/**
 * Static description of an operation run through {@link OperationGuard}.
 *
 * @param name               {@code <family>.<action>.<resource>} name used for audit and metrics
 * @param rateLimitOperation operation whose bucket and limits are charged
 * @param permission         permission required, or {@code null} for none
 * @param costOverride       tokens to charge instead of the configured cost, or {@code null}
 */
public record GuardedOperation(String name, String rateLimitOperation, String permission, Integer costOverride) {

    public GuardedOperation {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (rateLimitOperation == null || rateLimitOperation.isBlank()) {
            rateLimitOperation = name;
        }
        if (costOverride != null && costOverride <= 0) {
            throw new IllegalArgumentException("costOverride must be positive, got " + costOverride);
        }
    }

    /** An operation charged against its own name. */
    public static GuardedOperation of(String name, String permission) {
        return new GuardedOperation(name, name, permission, null);
    }

    public GuardedOperation chargedAs(String operation) {
        return new GuardedOperation(name, operation, permission, costOverride);
    }

    public GuardedOperation withCost(int cost) {
        return new GuardedOperation(name, rateLimitOperation, permission, cost);
    }
}
