package com.lumen.gateway.capability.repository;

import com.lumen.pagination.Node;

/** A repository registered by URL, as opposed to one discovered through an integration. */
public record GitRepository(String id, String name, String gitUrl) implements Node {
}
