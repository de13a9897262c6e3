package com.lumen.pagination;

import com.lumen.errors.CoreException;
import com.lumen.errors.FieldViolation;

import java.util.ArrayList;
import java.util.List;

/**
 * Client pagination arguments {@code (after, before, first, last)} after validation.
 *
 * <p>Built through {@link #of}, which decodes the cursors and rejects negative sizes. All problems
 * are reported together.
 */
public final class PageWindow {

    private final String afterId;
    private final String beforeId;
    private final Integer first;
    private final Integer last;

    private PageWindow(String afterId, String beforeId, Integer first, Integer last) {
        this.afterId = afterId;
        this.beforeId = beforeId;
        this.first = first;
        this.last = last;
    }

    /**
     * Validates raw client arguments.
     *
     * @throws CoreException INVALID_INPUT for malformed cursors or negative sizes
     */
    public static PageWindow of(String after, String before, Integer first, Integer last) {
        List<FieldViolation> violations = new ArrayList<>();
        String afterId = decode(after, "after", violations);
        String beforeId = decode(before, "before", violations);
        if (first != null && first < 0) {
            violations.add(new FieldViolation("first", "must be non-negative"));
        }
        if (last != null && last < 0) {
            violations.add(new FieldViolation("last", "must be non-negative"));
        }
        if (!violations.isEmpty()) {
            throw CoreException.invalidInput(violations);
        }
        return new PageWindow(afterId, beforeId, first, last);
    }

    /** No bounds, no limits. */
    public static PageWindow all() {
        return new PageWindow(null, null, null, null);
    }

    public static PageWindow first(int first) {
        return of(null, null, first, null);
    }

    private static String decode(String cursor, String argument, List<FieldViolation> violations) {
        if (cursor == null) {
            return null;
        }
        try {
            return CursorCodec.decode(cursor, argument);
        } catch (CoreException e) {
            violations.addAll(e.violations());
            return null;
        }
    }

    /**
     * The window forwarded to the backing fetch, with one look-ahead row in the limited direction.
     * <p>
     * With both {@code first} and {@code last}, only {@code first} is forwarded: the engine needs the
     * whole leading window to decide {@code hasNextPage} and cuts the trailing {@code last} rows itself.
     */
    FetchWindow toFetchWindow() {
        return new FetchWindow(
                afterId,
                beforeId,
                first == null ? null : withLookAhead(first),
                last == null || first != null ? null : withLookAhead(last));
    }

    // saturates at Integer.MAX_VALUE, no store holds that many rows
    private static int withLookAhead(int size) {
        return size == Integer.MAX_VALUE ? size : size + 1;
    }

    public String afterId() {
        return afterId;
    }

    public String beforeId() {
        return beforeId;
    }

    public Integer first() {
        return first;
    }

    public Integer last() {
        return last;
    }
}
