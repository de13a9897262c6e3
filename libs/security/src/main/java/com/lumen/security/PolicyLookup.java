package com.lumen.security;

/**
 * I/O needed by {@link AccessPolicy} for decisions that depend on stored state.
 * <p>
 * Implementations call the user-group and access-policy services; each call may block.
 */
public interface PolicyLookup {

    /** Whether the user is an admin of the given user group. */
    boolean isUserGroupAdmin(String userGroupId, String userId);

    /** Whether the user may read documents of the given source. */
    boolean canReadSource(String sourceId, String userId);
}
