package com.lumen.gateway.capability.thread;

import com.lumen.pagination.Node;

import java.time.Instant;

public record Message(String id, String threadId, Role role, String content, Instant createdAt) implements Node {

    public enum Role {
        USER,
        ASSISTANT
    }
}
