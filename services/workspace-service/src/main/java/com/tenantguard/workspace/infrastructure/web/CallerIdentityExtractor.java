package com.tenantguard.workspace.infrastructure.web;

import com.tenantguard.security.CallerIdentity;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Reads the caller identity that the upstream identity provider attached to the request.
 *
 * <p>The gateway in front of the service authenticates the caller and forwards the verified
 * subject in {@value #SUBJECT_HEADER}. The network origin is the first hop of
 * {@code X-Forwarded-For}, or the socket address when the header is absent.
 */
public final class CallerIdentityExtractor {

    public static final String SUBJECT_HEADER = "X-Authenticated-Subject";
    public static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private CallerIdentityExtractor() {
        // utility class
    }

    public static CallerIdentity from(HttpServletRequest request) {
        String subject = request.getHeader(SUBJECT_HEADER);
        String origin = networkOrigin(request);
        if (subject == null || subject.isBlank()) {
            return CallerIdentity.anonymous(origin);
        }
        return CallerIdentity.authenticated(subject.strip(), origin);
    }

    /**
     * @return the client address, or {@code null} when neither source yields one
     */
    public static String networkOrigin(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",", 2)[0].strip();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String remote = request.getRemoteAddr();
        return remote == null || remote.isBlank() ? null : remote;
    }
}
