package com.lumen.gateway.capability.usergroup;

import java.util.List;

/**
 * Groups allowed to read a document source. A source without groups is readable by everyone.
 */
public record SourceIdAccessPolicy(String sourceId, List<UserGroup> read) {

    public SourceIdAccessPolicy {
        read = read == null ? List.of() : List.copyOf(read);
    }
}
