package com.lumen.gateway.capability.thread;

import com.lumen.pagination.Node;

import java.time.Instant;

/**
 * A conversation with the assistant.
 *
 * @param userId    owner
 * @param ephemeral ephemeral threads are private to their owner and garbage-collected unless persisted
 */
public record ChatThread(String id, String userId, boolean ephemeral, Instant createdAt, Instant updatedAt)
        implements Node {
}
