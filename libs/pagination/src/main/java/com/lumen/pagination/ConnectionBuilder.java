package com.lumen.pagination;

import java.util.List;

/**
 * The cursor pagination engine.
 *
 * <p>Forwards a validated {@link PageWindow} to a {@link BackingFetch} and shapes the rows into a
 * {@link Connection}. Cursors are forwarded, never interpreted. The returned slice never holds
 * more than {@code max(first, last)} items; {@code hasNextPage} and {@code hasPreviousPage} are
 * true only when the fetch returned a row past the window in that direction.
 */
public final class ConnectionBuilder {

    private ConnectionBuilder() {
        // utility class
    }

    public static <T extends Node> Connection<T> query(PageWindow window, BackingFetch<T> fetch) {
        List<T> rows = fetch.fetch(window.toFetchWindow());
        if (rows == null) {
            rows = List.of();
        }

        boolean hasNextPage = false;
        boolean hasPreviousPage = false;
        if (window.first() != null && rows.size() > window.first()) {
            hasNextPage = true;
            rows = rows.subList(0, window.first());
        }
        if (window.last() != null && rows.size() > window.last()) {
            hasPreviousPage = true;
            rows = rows.subList(rows.size() - window.last(), rows.size());
        }

        List<Edge<T>> edges = rows.stream()
                .map(node -> new Edge<>(node, CursorCodec.encode(node.id())))
                .toList();
        String startCursor = edges.isEmpty() ? null : edges.get(0).cursor();
        String endCursor = edges.isEmpty() ? null : edges.get(edges.size() - 1).cursor();
        return new Connection<>(edges, new PageInfo(hasPreviousPage, hasNextPage, startCursor, endCursor));
    }

    /** Shorthand for {@code query(PageWindow.of(after, before, first, last), fetch)}. */
    public static <T extends Node> Connection<T> query(
            String after, String before, Integer first, Integer last, BackingFetch<T> fetch) {
        return query(PageWindow.of(after, before, first, last), fetch);
    }
}
