package com.lumen.pagination;

/**
 * One element of a {@link Connection}.
 *
 * @param node   the item
 * @param cursor opaque position of the item, usable as {@code after} or {@code before}
 */
public record Edge<T>(T node, String cursor) {
}
