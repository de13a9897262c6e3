package com.lumen.security;

import com.lumen.errors.CoreException;

import java.util.Collection;

/**
 * Authorization decisions of one user over resource classes.
 * <p>
 * Each {@code check*} method returns normally when access is granted and throws a FORBIDDEN
 * {@link CoreException} otherwise. Callers resolve the resource first, pass its owner attributes
 * here, and only mutate after the check returned. Created once per request; never mutated.
 */
public class AccessPolicy {

    private final String userId;
    private final boolean admin;
    private final PolicyLookup lookup;

    public AccessPolicy(String userId, boolean admin, PolicyLookup lookup) {
        this.userId = userId;
        this.admin = admin;
        this.lookup = lookup;
    }

    public String userId() {
        return userId;
    }

    public boolean isAdmin() {
        return admin;
    }

    private boolean isOwner(String ownerId) {
        return userId.equals(ownerId);
    }

    // analytics

    /**
     * Non-admins may only read their own statistics; an empty user list means "all users".
     */
    public void checkReadAnalytic(Collection<String> users) {
        if (admin) {
            return;
        }
        if (users == null || users.isEmpty()) {
            throw CoreException.forbidden("You must be admin to read analytic data for all users");
        }
        for (String id : users) {
            if (!isOwner(id)) {
                throw CoreException.forbidden("You must be admin to read other users' analytic data");
            }
        }
    }

    // threads

    /** Non-ephemeral threads are readable by every user of the instance. */
    public void checkReadThread(String ownerId, boolean ephemeral) {
        if (ephemeral && !isOwner(ownerId)) {
            throw CoreException.forbidden("You must be the thread owner to read an ephemeral thread");
        }
    }

    public void checkDeleteThread(String ownerId) {
        if (!isOwner(ownerId)) {
            throw CoreException.forbidden("You must be the thread owner to delete the thread");
        }
    }

    public void checkDeleteThreadMessages(String ownerId) {
        if (!isOwner(ownerId)) {
            throw CoreException.forbidden("You must be the thread owner to delete messages");
        }
    }

    public void checkUpdateThreadPersistence(String ownerId) {
        if (!isOwner(ownerId)) {
            throw CoreException.forbidden("You must be the thread owner to update its persistence");
        }
    }

    public void checkUpdateThreadMessage(String ownerId) {
        if (!isOwner(ownerId)) {
            throw CoreException.forbidden("You must be the thread owner to update its messages");
        }
    }

    // pages

    public void checkUpdatePage(String authorId) {
        if (!isOwner(authorId)) {
            throw CoreException.forbidden("You must be the page author to modify the page");
        }
    }

    // user groups

    /**
     * Admins manage every membership. A group admin manages memberships of their group, except
     * their own, and cannot appoint other group admins.
     */
    public void checkUpsertUserGroupMembership(String userGroupId, String memberId, boolean grantGroupAdmin) {
        if (admin) {
            return;
        }
        requireGroupAdmin(userGroupId);
        if (isOwner(memberId)) {
            throw CoreException.forbidden("You cannot modify your own membership");
        }
        if (grantGroupAdmin) {
            throw CoreException.forbidden("You must be admin to add a group admin");
        }
    }

    public void checkDeleteUserGroupMembership(String userGroupId, String memberId) {
        if (admin) {
            return;
        }
        requireGroupAdmin(userGroupId);
        if (isOwner(memberId)) {
            throw CoreException.forbidden("You cannot remove your own membership");
        }
    }

    private void requireGroupAdmin(String userGroupId) {
        if (!lookup.isUserGroupAdmin(userGroupId, userId)) {
            throw CoreException.forbidden("You must be admin of the user group to manage its memberships");
        }
    }

    // sources

    /** Admins read every source; other users are subject to the source's read policy. */
    public boolean canReadSource(String sourceId) {
        return admin || lookup.canReadSource(sourceId, userId);
    }
}
