package com.tenantguard.security;

public class AccountInactiveException extends OperationRejectedException {

    private final String userId;

    public AccountInactiveException(String userId) {
        super(RejectionReason.ACCOUNT_INACTIVE, "Account '%s' is inactive".formatted(userId));
        this.userId = userId;
    }

    public String userId() {
        return userId;
    }
}
