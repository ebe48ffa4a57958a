package com.tenantguard.security;

/**
 * Outcomes surfaced to callers when an operation is refused.
 * <p>
 * Only {@link #RATE_LIMITED} is retryable, and only after the advertised delay.
 * {@link #CROSS_TENANT_ACCESS} is security-relevant and is always audited under its own name,
 * even where the HTTP layer presents it as a not-found.
 */
public enum RejectionReason {

    UNAUTHENTICATED("unauthenticated", false),
    ACCOUNT_INACTIVE("account_inactive", false),
    RATE_LIMITED("rate_limited", true),
    PERMISSION_DENIED("permission_denied", false),
    CROSS_TENANT_ACCESS("cross_tenant_access", false),
    NOT_FOUND("not_found", false);

    private final String code;
    private final boolean retryable;

    RejectionReason(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    /** Stable lowercase code used in audit metadata and error payloads. */
    public String code() {
        return code;
    }

    public boolean retryable() {
        return retryable;
    }
}
