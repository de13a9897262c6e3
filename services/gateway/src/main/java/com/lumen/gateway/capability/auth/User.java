package com.lumen.gateway.capability.auth;

import com.lumen.pagination.Node;

import java.time.Instant;

/**
 * A user account as stored by the authentication service.
 *
 * @param id        stable id, also the pagination key
 * @param email     login email
 * @param name      display name
 * @param admin     instance admin flag
 * @param owner     the first admin of the instance
 * @param active    deactivated users cannot authenticate
 * @param createdAt creation time
 */
public record User(
        String id,
        String email,
        String name,
        boolean admin,
        boolean owner,
        boolean active,
        Instant createdAt) implements Node {
}
