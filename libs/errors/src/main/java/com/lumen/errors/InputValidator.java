package com.lumen.errors;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Runs Bean Validation on operation inputs and fails with one aggregated
 * {@link ErrorKind#INVALID_INPUT} listing every offending field.
 *
 * <p>Violations located inside a list element (paths such as {@code attachments[0].name}) cannot
 * be expressed as a flat field entry; they are logged and left out of the field list, but still
 * fail the input.
 */
public class InputValidator {

    private static final Logger log = LoggerFactory.getLogger(InputValidator.class);

    private final Validator validator;

    public InputValidator(Validator validator) {
        this.validator = validator;
    }

    /** Builds a validator from the default Bean Validation provider on the classpath. */
    public static InputValidator withDefaultProvider() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        return new InputValidator(factory.getValidator());
    }

    /**
     * Validates the input.
     *
     * @throws CoreException with kind {@link ErrorKind#INVALID_INPUT} when any constraint fails
     * @throws CoreException with kind {@link ErrorKind#INVALID_INPUT} when input is null
     */
    public <T> T validate(T input) {
        if (input == null) {
            throw CoreException.invalidInput("input", "must not be null");
        }
        Set<ConstraintViolation<T>> violations = validator.validate(input);
        if (violations.isEmpty()) {
            return input;
        }

        // one entry per field, several failed constraints on a field are joined
        Map<String, TreeSet<String>> byPath = new TreeMap<>();
        for (ConstraintViolation<T> violation : violations) {
            String path = violation.getPropertyPath().toString();
            if (isListElement(path)) {
                log.warn("List errors are not handled: {} {}", path, violation.getMessage());
                continue;
            }
            byPath.computeIfAbsent(path, p -> new TreeSet<>()).add(violation.getMessage());
        }

        List<FieldViolation> fields = new ArrayList<>(byPath.size());
        byPath.forEach((path, messages) -> fields.add(new FieldViolation(path, String.join("; ", messages))));
        throw CoreException.invalidInput(fields);
    }

    private static boolean isListElement(String path) {
        return path.indexOf('[') >= 0;
    }
}
