package com.lumen.pagination;

/**
 * Bounds handed to a {@link BackingFetch}.
 *
 * <p>Ids are already decoded from the client cursors. {@code first} and {@code last} are one
 * larger than the client asked for, so the fetch can report whether more rows exist. At most one
 * of them is set.
 *
 * @param afterId  exclusive lower bound, null for none
 * @param beforeId exclusive upper bound, null for none
 * @param first    number of rows to take from the start of the bounded range, null for none
 * @param last     number of rows to take from the end of the bounded range, null for none
 */
public record FetchWindow(String afterId, String beforeId, Integer first, Integer last) {

    public static FetchWindow unbounded() {
        return new FetchWindow(null, null, null, null);
    }
}
