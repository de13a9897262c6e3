package com.lumen.gateway.api;

import com.lumen.gateway.capability.usergroup.SourceIdAccessPolicy;
import com.lumen.gateway.capability.usergroup.UpsertMembershipInput;
import com.lumen.gateway.capability.usergroup.UserGroup;
import com.lumen.gateway.capability.usergroup.UserGroupInput;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.operation.UserGroupOperations;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class UserGroupController {

    private final UserGroupOperations operations;

    public UserGroupController(UserGroupOperations operations) {
        this.operations = operations;
    }

    @GetMapping("/user-groups")
    public List<UserGroup> userGroups(RequestContext ctx) {
        return operations.userGroups(ctx);
    }

    @PostMapping("/user-groups")
    public String createUserGroup(RequestContext ctx, @RequestBody UserGroupInput input) {
        return operations.createUserGroup(ctx, input);
    }

    @DeleteMapping("/user-groups/{id}")
    public boolean deleteUserGroup(RequestContext ctx, @PathVariable String id) {
        return operations.deleteUserGroup(ctx, id);
    }

    @PutMapping("/user-groups/{userGroupId}/members/{userId}")
    public boolean upsertUserGroupMembership(
            RequestContext ctx,
            @PathVariable String userGroupId,
            @PathVariable String userId,
            @RequestBody MembershipRequest request) {
        return operations.upsertUserGroupMembership(
                ctx, new UpsertMembershipInput(userGroupId, userId, request.groupAdmin()));
    }

    @DeleteMapping("/user-groups/{userGroupId}/members/{userId}")
    public boolean deleteUserGroupMembership(
            RequestContext ctx, @PathVariable String userGroupId, @PathVariable String userId) {
        return operations.deleteUserGroupMembership(ctx, userGroupId, userId);
    }

    @GetMapping("/sources/{sourceId}/access-policy")
    public SourceIdAccessPolicy sourceIdAccessPolicies(RequestContext ctx, @PathVariable String sourceId) {
        return operations.sourceIdAccessPolicies(ctx, sourceId);
    }

    @PutMapping("/sources/{sourceId}/access-policy/read/{userGroupId}")
    public boolean grantSourceIdReadAccess(
            RequestContext ctx, @PathVariable String sourceId, @PathVariable String userGroupId) {
        return operations.grantSourceIdReadAccess(ctx, sourceId, userGroupId);
    }

    @DeleteMapping("/sources/{sourceId}/access-policy/read/{userGroupId}")
    public boolean revokeSourceIdReadAccess(
            RequestContext ctx, @PathVariable String sourceId, @PathVariable String userGroupId) {
        return operations.revokeSourceIdReadAccess(ctx, sourceId, userGroupId);
    }

    public record MembershipRequest(boolean groupAdmin) {
    }
}
