package com.lumen.pagination;

import java.util.List;
import java.util.function.Function;

/**
 * Opaque-cursor paginated collection.
 *
 * @param edges    ordered items with their cursors
 * @param pageInfo navigation flags
 */
public record Connection<T>(List<Edge<T>> edges, PageInfo pageInfo) {

    public Connection {
        edges = List.copyOf(edges);
    }

    public static <T> Connection<T> empty() {
        return new Connection<>(List.of(), new PageInfo(false, false, null, null));
    }

    /** The nodes in edge order. */
    public List<T> nodes() {
        return edges.stream().map(Edge::node).toList();
    }

    /** Converts every node, keeping cursors and page info. */
    public <R> Connection<R> map(Function<? super T, ? extends R> mapper) {
        List<Edge<R>> mapped = edges.stream()
                .map(edge -> new Edge<R>(mapper.apply(edge.node()), edge.cursor()))
                .toList();
        return new Connection<>(mapped, pageInfo);
    }
}
