package com.lumen.security;

/**
 * A principal resolved against the current user record.
 *
 * @param id     user id
 * @param admin  current admin flag from the user record (not from the token)
 * @param policy authorization decisions for this user
 */
public record AuthorizedUser(String id, boolean admin, AccessPolicy policy) {
}
