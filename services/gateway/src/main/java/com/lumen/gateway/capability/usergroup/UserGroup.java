package com.lumen.gateway.capability.usergroup;

import com.lumen.pagination.Node;

import java.time.Instant;
import java.util.List;

public record UserGroup(String id, String name, List<Member> members, Instant createdAt) implements Node {

    public UserGroup {
        members = members == null ? List.of() : List.copyOf(members);
    }

    public record Member(String userId, boolean groupAdmin) {
    }
}
