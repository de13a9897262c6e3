package com.lumen.gateway.guard;

import com.lumen.gateway.capability.usergroup.AccessPolicyService;
import com.lumen.gateway.capability.usergroup.UserGroupService;
import com.lumen.security.PolicyLookup;

/**
 * Answers access-policy questions from the user-group and access-policy services.
 */
class ServicePolicyLookup implements PolicyLookup {

    private final UserGroupService userGroups;
    private final AccessPolicyService accessPolicies;

    ServicePolicyLookup(UserGroupService userGroups, AccessPolicyService accessPolicies) {
        this.userGroups = userGroups;
        this.accessPolicies = accessPolicies;
    }

    @Override
    public boolean isUserGroupAdmin(String userGroupId, String userId) {
        return userGroups.isGroupAdmin(userGroupId, userId);
    }

    @Override
    public boolean canReadSource(String sourceId, String userId) {
        return accessPolicies.canRead(sourceId, userId);
    }
}
