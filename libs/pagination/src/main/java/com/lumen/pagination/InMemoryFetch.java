package com.lumen.pagination;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Reference {@link BackingFetch} over an in-memory snapshot.
 *
 * <p>Items are ordered by id with the supplied comparator; bounds compare ids with the same
 * comparator, so a cursor keeps its meaning after the item it was minted from is deleted.
 */
public final class InMemoryFetch<T extends Node> implements BackingFetch<T> {

    /** Numeric ids in numeric order, anything else lexicographically after them. */
    public static final Comparator<String> NATURAL_ID_ORDER =
            Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder());

    private final Supplier<? extends List<? extends T>> snapshot;
    private final Comparator<String> idOrder;

    private InMemoryFetch(Supplier<? extends List<? extends T>> snapshot, Comparator<String> idOrder) {
        this.snapshot = snapshot;
        this.idOrder = idOrder;
    }

    public static <T extends Node> InMemoryFetch<T> of(Supplier<? extends List<? extends T>> snapshot) {
        return new InMemoryFetch<>(snapshot, NATURAL_ID_ORDER);
    }

    public static <T extends Node> InMemoryFetch<T> of(
            Supplier<? extends List<? extends T>> snapshot, Comparator<String> idOrder) {
        return new InMemoryFetch<>(snapshot, idOrder);
    }

    @Override
    public List<T> fetch(FetchWindow window) {
        List<T> rows = new ArrayList<>();
        for (T item : snapshot.get()) {
            if (window.afterId() != null && idOrder.compare(item.id(), window.afterId()) <= 0) {
                continue;
            }
            if (window.beforeId() != null && idOrder.compare(item.id(), window.beforeId()) >= 0) {
                continue;
            }
            rows.add(item);
        }
        rows.sort(Comparator.comparing(Node::id, idOrder));

        if (window.first() != null && rows.size() > window.first()) {
            rows = rows.subList(0, window.first());
        }
        if (window.last() != null && rows.size() > window.last()) {
            rows = rows.subList(rows.size() - window.last(), rows.size());
        }
        return List.copyOf(rows);
    }
}
