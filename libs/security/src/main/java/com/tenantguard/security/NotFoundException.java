package com.tenantguard.security;

public class NotFoundException extends OperationRejectedException {

    private final String kind;
    private final String id;

    public NotFoundException(String kind, String id) {
        super(RejectionReason.NOT_FOUND, "%s/%s not found".formatted(kind, id));
        this.kind = kind;
        this.id = id;
    }

    /**
     * Builds the not-found rejection for a {@code kind/id} reference, e.g. {@code contracts/42}.
     * A reference without a separator is treated as a bare id.
     */
    public static NotFoundException forReference(String reference) {
        int slash = reference.indexOf('/');
        if (slash < 0) {
            return new NotFoundException("resource", reference);
        }
        return new NotFoundException(reference.substring(0, slash), reference.substring(slash + 1));
    }

    public String kind() {
        return kind;
    }

    public String id() {
        return id;
    }
}
