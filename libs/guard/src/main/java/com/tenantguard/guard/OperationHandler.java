package com.tenantguard.guard;

/**
 * Business logic run by {@link OperationGuard} once the caller has been admitted.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface OperationHandler<T> {

    T handle(TenantScope scope);
}
