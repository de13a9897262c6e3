package com.lumen.pagination;

import java.util.List;

/**
 * Ordered fetch provided by a capability.
 *
 * <p>Contract: rows come back in ascending order of the store's total order, restricted to the
 * ids strictly between {@code afterId} and {@code beforeId}. With {@code first} the leading rows
 * are kept, with {@code last} the trailing ones; when both are present, {@code first} is applied
 * before {@code last}. {@link ConnectionBuilder} never sends both.
 */
@FunctionalInterface
public interface BackingFetch<T> {

    List<T> fetch(FetchWindow window);
}
