package com.lumen.security;

/**
 * Verified identity behind an inbound request.
 * <p>
 * Produced by verifying a bearer credential; absent for anonymous requests. Lives for one
 * request or one subscription and is never mutated.
 *
 * @param subject                user id (JWT 'sub' claim)
 * @param admin                  whether the token was issued to an admin
 * @param generatedFromAuthToken true when the principal comes from a long-lived user auth token
 *                               rather than an interactive session
 */
public record Principal(String subject, boolean admin, boolean generatedFromAuthToken) {

    public Principal {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be null or blank");
        }
    }

    /** True when this principal refers to the given user id. */
    public boolean is(String userId) {
        return subject.equals(userId);
    }
}
