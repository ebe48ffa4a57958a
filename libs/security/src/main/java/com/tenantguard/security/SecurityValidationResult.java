package com.tenantguard.security;

import java.util.List;

/**
 * Outcome of {@link SecurityContextValidator}: valid with no errors, or invalid with at least one.
 *
 * @param valid  whether every check passed
 * @param errors validation messages, empty when valid
 */
public record SecurityValidationResult(boolean valid, List<String> errors) {

    public static SecurityValidationResult ok() {
        return new SecurityValidationResult(true, List.of());
    }

    public static SecurityValidationResult fail(List<String> errors) {
        return new SecurityValidationResult(false, List.copyOf(errors));
    }
}
