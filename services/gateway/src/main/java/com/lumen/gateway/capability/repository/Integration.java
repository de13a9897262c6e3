package com.lumen.gateway.capability.repository;

import com.lumen.pagination.Node;

import java.time.Instant;

/**
 * A connection to a code host used to discover repositories. The access token is write-only.
 */
public record Integration(
        String id,
        IntegrationKind kind,
        String displayName,
        String apiBase,
        Status status,
        Instant createdAt) implements Node {

    public enum Status {
        READY,
        PENDING,
        FAILED
    }
}
