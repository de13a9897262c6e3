package com.lumen.gateway.capability.usergroup;

public interface AccessPolicyService {

    SourceIdAccessPolicy read(String sourceId);

    void grantSourceIdReadAccess(String sourceId, String userGroupId);

    void revokeSourceIdReadAccess(String sourceId, String userGroupId);

    boolean canRead(String sourceId, String userId);
}
