package com.tenantguard.guard;

import com.tenantguard.security.RejectionReason;

import java.util.Locale;

/**
 * Audited result of a guarded operation.
 */
public enum OperationOutcome {

    SUCCESS,
    UNAUTHENTICATED,
    ACCOUNT_INACTIVE,
    RATE_LIMITED,
    PERMISSION_DENIED,
    CROSS_TENANT_ACCESS,
    NOT_FOUND,
    INTERNAL_ERROR;

    public static OperationOutcome of(RejectionReason reason) {
        return switch (reason) {
            case UNAUTHENTICATED -> UNAUTHENTICATED;
            case ACCOUNT_INACTIVE -> ACCOUNT_INACTIVE;
            case RATE_LIMITED -> RATE_LIMITED;
            case PERMISSION_DENIED -> PERMISSION_DENIED;
            case CROSS_TENANT_ACCESS -> CROSS_TENANT_ACCESS;
            case NOT_FOUND -> NOT_FOUND;
        };
    }

    /** Lowercase form used in metric tags and audit metadata. */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
