package com.lumen.gateway.capability.repository;

public enum IntegrationKind {
    GITHUB,
    GITLAB,
    GITHUB_SELF_HOSTED,
    GITLAB_SELF_HOSTED
}
