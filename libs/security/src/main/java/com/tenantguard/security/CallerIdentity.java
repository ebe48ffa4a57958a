package com.tenantguard.security;

import java.util.Map;
import java.util.Optional;

/**
 * What the upstream identity provider tells us about a caller. Tokens are validated upstream;
 * this type only carries the result.
 *
 * @param subject       stable subject identifier, or {@code null} for an anonymous caller
 * @param claims        extra claims from the provider, never {@code null}
 * @param networkOrigin caller-supplied network origin (e.g. client IP), or {@code null}
 */
public record CallerIdentity(String subject, Map<String, String> claims, String networkOrigin) {

    public CallerIdentity {
        claims = claims == null ? Map.of() : Map.copyOf(claims);
        if (subject != null && subject.isBlank()) {
            subject = null;
        }
        if (networkOrigin != null && networkOrigin.isBlank()) {
            networkOrigin = null;
        }
    }

    public static CallerIdentity authenticated(String subject, String networkOrigin) {
        return new CallerIdentity(subject, Map.of(), networkOrigin);
    }

    public static CallerIdentity anonymous(String networkOrigin) {
        return new CallerIdentity(null, Map.of(), networkOrigin);
    }

    public Optional<String> subjectIfPresent() {
        return Optional.ofNullable(subject);
    }

    public Optional<String> networkOriginIfPresent() {
        return Optional.ofNullable(networkOrigin);
    }
}
