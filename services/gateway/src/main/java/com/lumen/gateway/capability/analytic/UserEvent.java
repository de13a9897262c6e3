package com.lumen.gateway.capability.analytic;

import com.lumen.pagination.Node;

import java.time.Instant;

public record UserEvent(String id, String userId, String kind, Instant createdAt, String payload) implements Node {
}
