package com.lumen.gateway.operation;

import com.lumen.pagination.PageWindow;

/**
 * Raw pagination arguments of a list query. Parsed only after the guard has passed, so anonymous
 * callers see UNAUTHORIZED rather than cursor errors.
 */
public record PageArguments(String after, String before, Integer first, Integer last) {

    public static PageArguments all() {
        return new PageArguments(null, null, null, null);
    }

    public static PageArguments first(int first) {
        return new PageArguments(null, null, first, null);
    }

    public PageWindow window() {
        return PageWindow.of(after, before, first, last);
    }
}
