package com.lumen.errors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link InputValidator} against the Hibernate Validator provider.
 */
@DisplayName("InputValidator")
class InputValidatorTest {

    record Attachment(@NotBlank String name) {}

    record SampleInput(
            @NotBlank String title,
            @Size(min = 1, max = 8) String content,
            List<@Valid Attachment> attachments) {}

    private final InputValidator validator = InputValidator.withDefaultProvider();

    @Test
    @DisplayName("returns valid input unchanged")
    void acceptsValidInput() {
        var input = new SampleInput("hello", "world", List.of());

        assertThat(validator.validate(input)).isSameAs(input);
    }

    @Test
    @DisplayName("two invalid fields yield one failure with exactly two entries")
    void aggregatesViolations() {
        var ex = catchThrowableOfType(
                () -> validator.validate(new SampleInput(" ", "far too long", List.of())),
                CoreException.class);

        assertThat(ex.kind()).isEqualTo(ErrorKind.INVALID_INPUT);
        assertThat(ex.violations()).extracting(FieldViolation::path).containsExactly("content", "title");
    }

    @Test
    @DisplayName("list element violations fail the input but are not reported per field")
    void listViolationsAreNotFlattened() {
        var ex = catchThrowableOfType(
                () -> validator.validate(new SampleInput("ok", "ok", List.of(new Attachment("")))),
                CoreException.class);

        assertThat(ex.kind()).isEqualTo(ErrorKind.INVALID_INPUT);
        assertThat(ex.violations()).isEmpty();
    }

    @Test
    @DisplayName("null input is an input error")
    void rejectsNull() {
        assertThatThrownBy(() -> validator.validate(null))
                .isInstanceOfSatisfying(CoreException.class,
                        e -> assertThat(e.violations()).extracting(FieldViolation::path).containsExactly("input"));
    }
}
