package com.tenantguard.security;

/**
 * Base type of the caller-facing outcome taxonomy.
 * <p>
 * Storage or programming failures must never be expressed as a subclass of this type; they
 * propagate as ordinary runtime exceptions and are reported as internal errors.
 */
public abstract class OperationRejectedException extends RuntimeException {

    private final RejectionReason reason;

    protected OperationRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RejectionReason reason() {
        return reason;
    }
}
