package com.lumen.security;

import java.util.Optional;

/**
 * Loads the current user record for a principal.
 * <p>
 * Returns empty when the user was deleted or deactivated after the credential was issued.
 */
@FunctionalInterface
public interface UserResolver {

    Optional<AuthorizedUser> resolve(Principal principal);
}
