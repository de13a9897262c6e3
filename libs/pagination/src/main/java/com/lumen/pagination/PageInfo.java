package com.lumen.pagination;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Navigation flags of a {@link Connection}.
 *
 * @param hasPreviousPage true when the backing fetch found a row before the returned window
 * @param hasNextPage     true when the backing fetch found a row after the returned window
 * @param startCursor     cursor of the first edge, null when empty
 * @param endCursor       cursor of the last edge, null when empty
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PageInfo(boolean hasPreviousPage, boolean hasNextPage, String startCursor, String endCursor) {
}
