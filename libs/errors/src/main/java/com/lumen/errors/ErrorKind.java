package com.lumen.errors;

import java.util.Optional;

/**
 * Internal error taxonomy of the gateway.
 *
 * <p>Several kinds may share a client-facing {@link ErrorCode}; {@link #OTHER} has none.
 */
public enum ErrorKind {
    UNAUTHORIZED(ErrorCode.UNAUTHORIZED),
    FORBIDDEN(ErrorCode.FORBIDDEN),
    NOT_FOUND(ErrorCode.NOT_FOUND),
    INVALID_ID(ErrorCode.INVALID_ID),
    INVALID_INPUT(ErrorCode.INVALID_INPUT),
    EMAIL_NOT_CONFIGURED(ErrorCode.NOT_ENABLED),
    FEATURE_NOT_ENABLED(ErrorCode.NOT_ENABLED),
    INVALID_LICENSE(ErrorCode.INVALID_LICENSE),
    OTHER(null);

    private final ErrorCode code;

    ErrorKind(ErrorCode code) {
        this.code = code;
    }

    /** The client-facing code, empty for opaque infrastructure failures. */
    public Optional<ErrorCode> code() {
        return Optional.ofNullable(code);
    }
}
