package com.tenantguard.guard;

/**
 * A guarded operation failed for a reason outside the rejection taxonomy, such as a storage
 * error. Callers get no retry guidance.
 */
public class InternalOperationException extends RuntimeException {

    private final String operation;

    public InternalOperationException(String operation, Throwable cause) {
        super("Operation '%s' failed".formatted(operation), cause);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }
}
