package com.lumen.errors;

/**
 * One offending input field.
 *
 * @param path    property path of the field, e.g. {@code title}
 * @param message human-readable reason
 */
public record FieldViolation(String path, String message) {
}
