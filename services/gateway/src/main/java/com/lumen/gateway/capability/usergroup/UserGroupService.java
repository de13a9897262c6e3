package com.lumen.gateway.capability.usergroup;

import java.util.List;

public interface UserGroupService {

    List<UserGroup> list();

    String create(String name);

    void delete(String id);

    void upsertMembership(UpsertMembershipInput input);

    void deleteMembership(String userGroupId, String userId);

    boolean isGroupAdmin(String userGroupId, String userId);
}
