package com.lumen.gateway.capability.page;

import com.lumen.pagination.Node;

/**
 * @param position zero-based order of the section inside its page
 */
public record PageSection(String id, String pageId, String title, String content, int position) implements Node {
}
