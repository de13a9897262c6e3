package com.lumen.errors;

/**
 * Machine-readable discriminator carried by every structured error the gateway returns.
 *
 * <p>The set is closed: clients switch on it. Generic failures carry no code at all.
 */
public enum ErrorCode {
    UNAUTHORIZED(401),
    FORBIDDEN(403),
    NOT_FOUND(404),
    INVALID_ID(400),
    INVALID_INPUT(400),
    INVALID_LICENSE(403),
    NOT_ENABLED(503);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    /** The HTTP status used when the error is rendered over HTTP. */
    public int httpStatus() {
        return httpStatus;
    }
}
