package com.lumen.pagination;

/**
 * An item that can appear in a {@link Connection}.
 *
 * <p>The id must be stable and belong to the same total order the backing store uses to list the
 * items; cursors are minted from it.
 */
public interface Node {

    String id();
}
