package com.lumen.errors;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Client-facing error envelope.
 *
 * @param code       discriminating code, null for generic failures
 * @param message    human-readable message, never a stack trace
 * @param extensions structured detail such as field-level validation errors
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record StructuredError(ErrorCode code, String message, Map<String, Object> extensions) {

    public StructuredError {
        extensions = extensions == null ? Map.of() : Map.copyOf(extensions);
    }

    public static StructuredError of(ErrorCode code, String message) {
        return new StructuredError(code, message, Map.of());
    }
}
