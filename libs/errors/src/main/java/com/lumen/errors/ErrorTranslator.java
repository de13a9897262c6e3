package com.lumen.errors;

import com.lumen.observability.SensitiveDataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps any failure of a gateway operation to a {@link StructuredError}.
 *
 * <p>Mapping:
 *
 * <ul>
 *   <li>{@link CoreException} with a coded kind → that code and its message
 *   <li>{@link ErrorKind#INVALID_INPUT} → {@code extensions.validation-errors.errors[]} with one
 *       {@code {path, message}} entry per offending field
 *   <li>{@link ErrorKind#OTHER} → no code, message passed through with secrets masked
 *   <li>any other throwable → no code, a fixed message; details only go to the log
 * </ul>
 *
 * <p>Stateless and thread-safe.
 */
public class ErrorTranslator {

    private static final Logger log = LoggerFactory.getLogger(ErrorTranslator.class);

    public static final String VALIDATION_ERRORS = "validation-errors";
    public static final String UNEXPECTED_MESSAGE = "An unexpected error occurred";

    private final SensitiveDataRedactor redactor;

    public ErrorTranslator() {
        this(new SensitiveDataRedactor());
    }

    public ErrorTranslator(SensitiveDataRedactor redactor) {
        this.redactor = redactor;
    }

    public StructuredError translate(Throwable failure) {
        if (failure instanceof CoreException core) {
            return translateCore(core);
        }
        log.error("Unhandled failure in gateway operation", failure);
        return StructuredError.of(null, UNEXPECTED_MESSAGE);
    }

    private StructuredError translateCore(CoreException ex) {
        if (ex.is(ErrorKind.OTHER)) {
            log.error("Operation failed: {}", redactor.redactMessage(ex.getMessage()), ex.getCause());
            String message = ex.getMessage() == null ? UNEXPECTED_MESSAGE : redactor.redactMessage(ex.getMessage());
            return StructuredError.of(null, message);
        }

        ErrorCode code = ex.kind().code().orElseThrow();
        log.warn("Operation rejected [{}]: {}", code, ex.getMessage());
        if (ex.is(ErrorKind.INVALID_INPUT)) {
            return new StructuredError(code, ex.getMessage(), validationExtensions(ex.violations()));
        }
        return StructuredError.of(code, ex.getMessage());
    }

    private static Map<String, Object> validationExtensions(List<FieldViolation> violations) {
        List<Map<String, Object>> errors = violations.stream()
                .map(v -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("path", v.path());
                    entry.put("message", v.message() == null ? "" : v.message());
                    return entry;
                })
                .toList();
        return Map.of(VALIDATION_ERRORS, Map.of("errors", errors));
    }
}
