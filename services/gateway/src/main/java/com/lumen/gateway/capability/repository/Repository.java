package com.lumen.gateway.capability.repository;

import java.util.List;

/**
 * A repository available for code search, whatever its origin.
 *
 * @param sourceId document source the repository is indexed under, used for read access
 * @param refs     branch and tag names
 */
public record Repository(String id, String sourceId, String name, RepositoryKind kind, String gitUrl, List<String> refs) {

    public Repository {
        refs = refs == null ? List.of() : List.copyOf(refs);
    }
}
