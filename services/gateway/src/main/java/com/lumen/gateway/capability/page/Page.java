package com.lumen.gateway.capability.page;

import com.lumen.pagination.Node;

import java.time.Instant;

/**
 * A generated document.
 *
 * @param authorId only the author may edit the page
 * @param content  summary above the first section, null until generated
 */
public record Page(String id, String authorId, String title, String content, Instant createdAt, Instant updatedAt)
        implements Node {
}
