package com.lumen.security;

import com.lumen.errors.CoreException;

import java.util.Optional;
import java.util.Set;

/**
 * Checks run at the top of every gateway operation, before any capability call that changes
 * state.
 * <p>
 * All checks are side-effect free and fail with a terminal {@link CoreException}; none retries.
 */
public final class AuthorizationGuard {

    private AuthorizationGuard() {
        // utility class
    }

    /**
     * Requires a principal, without loading the user record.
     *
     * @throws CoreException UNAUTHORIZED when the request is anonymous
     */
    public static Principal requirePrincipal(Optional<Principal> principal) {
        return principal.orElseThrow(() -> CoreException.unauthorized("You're not logged in"));
    }

    /**
     * Requires a principal whose user still exists and is active.
     *
     * @param allowAuthToken whether principals derived from a user auth token are accepted
     * @throws CoreException UNAUTHORIZED when anonymous or the user is gone, FORBIDDEN when an
     *                       auth-token principal calls an operation that does not accept one
     */
    public static AuthorizedUser requireAuthenticated(
            Optional<Principal> principal, boolean allowAuthToken, UserResolver users) {
        Principal claims = requirePrincipal(principal);
        if (!allowAuthToken && claims.generatedFromAuthToken()) {
            throw CoreException.forbidden("Invoking this API with an auth token is not allowed");
        }
        return users.resolve(claims)
                .orElseThrow(() -> CoreException.unauthorized("User not found or no longer active"));
    }

    /**
     * @throws CoreException FORBIDDEN when the authenticated user is not an admin
     */
    public static AuthorizedUser requireAdmin(Optional<Principal> principal, UserResolver users) {
        AuthorizedUser user = requireAuthenticated(principal, false, users);
        if (!user.admin()) {
            throw CoreException.forbidden("You must be admin to proceed");
        }
        return user;
    }

    /**
     * @throws CoreException INVALID_LICENSE when the tier is not allowed or the license is invalid
     */
    public static void requireLicense(License license, Set<LicenseTier> allowedTiers) {
        if (license == null || !allowedTiers.contains(license.tier())) {
            throw CoreException.invalidLicense("Your plan doesn't include support for this feature.");
        }
        license.ensureValid();
    }

    /**
     * Rejects admin mutations that target the caller's own account.
     *
     * @throws CoreException FORBIDDEN when {@code targetId} is the caller
     */
    public static void requireNotSelf(Optional<Principal> principal, String targetId, String message) {
        if (principal.map(p -> p.is(targetId)).orElse(false)) {
            throw CoreException.forbidden(message);
        }
    }

    /**
     * Rejects user-scoped mutations that target somebody else.
     *
     * @throws CoreException UNAUTHORIZED when {@code targetId} is not the caller
     */
    public static Principal requireSelf(Optional<Principal> principal, String targetId, String message) {
        Principal claims = requirePrincipal(principal);
        if (!claims.is(targetId)) {
            throw CoreException.unauthorized(message);
        }
        return claims;
    }
}
