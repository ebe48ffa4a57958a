package com.tenantguard.security;

/**
 * The request carries no identity, or one that maps to no account. Not retryable.
 */
public class UnauthenticatedException extends OperationRejectedException {

    public UnauthenticatedException(String message) {
        super(RejectionReason.UNAUTHENTICATED, message);
    }
}
