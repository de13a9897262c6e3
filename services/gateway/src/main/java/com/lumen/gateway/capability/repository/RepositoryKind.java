package com.lumen.gateway.capability.repository;

public enum RepositoryKind {
    GIT,
    GITHUB,
    GITLAB,
    GITHUB_SELF_HOSTED,
    GITLAB_SELF_HOSTED
}
