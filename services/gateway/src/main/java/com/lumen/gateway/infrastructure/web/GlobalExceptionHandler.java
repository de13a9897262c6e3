package com.lumen.gateway.infrastructure.web;

import com.lumen.errors.CoreException;
import com.lumen.errors.ErrorCode;
import com.lumen.errors.ErrorTranslator;
import com.lumen.errors.StructuredError;
import com.lumen.observability.CorrelationContextHolder;
import com.lumen.observability.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.time.Instant;
import java.util.Locale;

/**
 * Renders every failure as an RFC 7807 {@link ProblemDetail}.
 * <p>
 * The body carries the {@link ErrorTranslator} output: {@code code} (absent for generic failures),
 * {@code detail} and, for invalid input, the {@code validation-errors} extension. A correlation id
 * and timestamp are added so clients can quote them to support:
 *
 * <pre>
 * {
 *   "type": "https://lumen.dev/errors/forbidden",
 *   "title": "Forbidden",
 *   "status": 403,
 *   "detail": "You must be admin to proceed",
 *   "code": "FORBIDDEN",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String ERROR_TYPE_BASE = "https://lumen.dev/errors/";

    private final ErrorTranslator translator;
    private final MetricFactory metrics;

    public GlobalExceptionHandler(ErrorTranslator translator, MetricFactory metrics) {
        this.translator = translator;
        this.metrics = metrics;
    }

    @ExceptionHandler(CoreException.class)
    public ProblemDetail handleCore(CoreException ex) {
        return render(translator.translate(ex));
    }

    /** Unreadable JSON bodies, missing parameters and parameters of the wrong type. */
    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            BindException.class})
    public ProblemDetail handleUnreadable(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return render(translator.translate(CoreException.invalidInput("body", "malformed request")));
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        return render(translator.translate(ex));
    }

    ProblemDetail render(StructuredError error) {
        ErrorCode code = error.code();
        HttpStatus status = code == null ? HttpStatus.INTERNAL_SERVER_ERROR : HttpStatus.valueOf(code.httpStatus());
        String slug = code == null ? "internal" : code.name().toLowerCase(Locale.ROOT).replace('_', '-');

        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, error.message());
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(ERROR_TYPE_BASE + slug));
        if (code != null) {
            problem.setProperty("code", code.name());
        }
        error.extensions().forEach(problem::setProperty);
        enrichWithCorrelation(problem);

        metrics.counter("lumen.errors", "Errors returned to clients", "code", code == null ? "NONE" : code.name())
                .increment();
        return problem;
    }

    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
