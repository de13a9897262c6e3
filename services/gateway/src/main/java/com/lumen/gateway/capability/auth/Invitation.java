package com.lumen.gateway.capability.auth;

import com.lumen.pagination.Node;

import java.time.Instant;

public record Invitation(String id, String email, String code, Instant createdAt) implements Node {
}
