package com.lumen.gateway.operation;

import com.lumen.errors.InputValidator;
import com.lumen.gateway.capability.usergroup.SourceIdAccessPolicy;
import com.lumen.gateway.capability.usergroup.UpsertMembershipInput;
import com.lumen.gateway.capability.usergroup.UserGroup;
import com.lumen.gateway.capability.usergroup.UserGroupInput;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.guard.Guards;
import com.lumen.security.AuthorizedUser;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * User groups and the source read-access policies built on them.
 */
@Service
public class UserGroupOperations {

    private final InputValidator validator;

    public UserGroupOperations(InputValidator validator) {
        this.validator = validator;
    }

    public List<UserGroup> userGroups(RequestContext ctx) {
        Guards.user(ctx);
        return ctx.services().userGroup().list();
    }

    public String createUserGroup(RequestContext ctx, UserGroupInput input) {
        Guards.admin(ctx);
        validator.validate(input);
        return ctx.services().userGroup().create(input.name());
    }

    public boolean deleteUserGroup(RequestContext ctx, String id) {
        Guards.admin(ctx);
        ctx.services().userGroup().delete(id);
        return true;
    }

    /** Admins and group admins only; group admins cannot change their own membership. */
    public boolean upsertUserGroupMembership(RequestContext ctx, UpsertMembershipInput input) {
        AuthorizedUser user = Guards.user(ctx);
        validator.validate(input);
        user.policy().checkUpsertUserGroupMembership(input.userGroupId(), input.userId(), input.groupAdmin());
        ctx.services().userGroup().upsertMembership(input);
        return true;
    }

    public boolean deleteUserGroupMembership(RequestContext ctx, String userGroupId, String userId) {
        AuthorizedUser user = Guards.user(ctx);
        user.policy().checkDeleteUserGroupMembership(userGroupId, userId);
        ctx.services().userGroup().deleteMembership(userGroupId, userId);
        return true;
    }

    public SourceIdAccessPolicy sourceIdAccessPolicies(RequestContext ctx, String sourceId) {
        Guards.admin(ctx);
        return ctx.services().accessPolicy().read(sourceId);
    }

    public boolean grantSourceIdReadAccess(RequestContext ctx, String sourceId, String userGroupId) {
        Guards.admin(ctx);
        ctx.services().accessPolicy().grantSourceIdReadAccess(sourceId, userGroupId);
        return true;
    }

    public boolean revokeSourceIdReadAccess(RequestContext ctx, String sourceId, String userGroupId) {
        Guards.admin(ctx);
        ctx.services().accessPolicy().revokeSourceIdReadAccess(sourceId, userGroupId);
        return true;
    }
}
