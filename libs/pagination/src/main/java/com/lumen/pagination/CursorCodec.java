package com.lumen.pagination;

import com.lumen.errors.CoreException;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Mints and reads opaque cursors.
 *
 * <p>A cursor is the URL-safe Base64 of {@code cursor:<id>}. Clients must treat it as opaque; it
 * never encodes an offset.
 */
public final class CursorCodec {

    private static final String PREFIX = "cursor:";

    private CursorCodec() {
        // utility class
    }

    public static String encode(String id) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("id must not be null or empty");
        }
        byte[] raw = (PREFIX + id).getBytes(StandardCharsets.UTF_8);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw);
    }

    /**
     * Decodes a cursor back to the id it was minted from.
     *
     * @param cursor   the client-supplied cursor
     * @param argument argument name reported in the validation error, e.g. {@code after}
     * @throws CoreException INVALID_INPUT when the cursor was not minted by {@link #encode}
     */
    public static String decode(String cursor, String argument) {
        String text;
        try {
            text = new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw malformed(argument);
        }
        if (!text.startsWith(PREFIX) || text.length() == PREFIX.length()) {
            throw malformed(argument);
        }
        return text.substring(PREFIX.length());
    }

    private static CoreException malformed(String argument) {
        return CoreException.invalidInput(argument, "malformed cursor");
    }
}
