package com.lumen.errors;

import java.util.List;

/**
 * Terminal failure of a gateway operation.
 *
 * <p>Guards, validators and capabilities all fail with this type; the {@link ErrorTranslator}
 * turns it into a {@link StructuredError}. Nothing in the gateway retries on it.
 */
public class CoreException extends RuntimeException {

    private final ErrorKind kind;
    private final List<FieldViolation> violations;

    protected CoreException(ErrorKind kind, String message, List<FieldViolation> violations, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.violations = List.copyOf(violations);
    }

    public static CoreException unauthorized(String message) {
        return new CoreException(ErrorKind.UNAUTHORIZED, message, List.of(), null);
    }

    public static CoreException forbidden(String message) {
        return new CoreException(ErrorKind.FORBIDDEN, message, List.of(), null);
    }

    public static CoreException notFound(String message) {
        return new CoreException(ErrorKind.NOT_FOUND, message, List.of(), null);
    }

    public static CoreException invalidId() {
        return new CoreException(ErrorKind.INVALID_ID, "Invalid ID", List.of(), null);
    }

    /**
     * Aggregated validation failure. Every offending field is listed; an empty list is allowed
     * when the only problems were of a shape that cannot be reported per field.
     */
    public static CoreException invalidInput(List<FieldViolation> violations) {
        return new CoreException(ErrorKind.INVALID_INPUT, "Invalid input parameters", violations, null);
    }

    public static CoreException invalidInput(String path, String message) {
        return invalidInput(List.of(new FieldViolation(path, message)));
    }

    public static CoreException emailNotConfigured() {
        return new CoreException(ErrorKind.EMAIL_NOT_CONFIGURED, "SMTP is not configured", List.of(), null);
    }

    public static CoreException notEnabled(String message) {
        return new CoreException(ErrorKind.FEATURE_NOT_ENABLED, message, List.of(), null);
    }

    public static CoreException invalidLicense(String message) {
        return new CoreException(ErrorKind.INVALID_LICENSE, message, List.of(), null);
    }

    /** Opaque downstream failure; the message is shown to the client after redaction. */
    public static CoreException other(String message, Throwable cause) {
        return new CoreException(ErrorKind.OTHER, message, List.of(), cause);
    }

    public static CoreException other(String message) {
        return other(message, null);
    }

    public ErrorKind kind() {
        return kind;
    }

    public List<FieldViolation> violations() {
        return violations;
    }

    /** Shorthand for {@code kind() == kind}. */
    public boolean is(ErrorKind kind) {
        return this.kind == kind;
    }
}
