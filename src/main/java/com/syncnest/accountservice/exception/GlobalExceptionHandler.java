package com.syncnest.accountservice.exception;

import com.syncnest.accountservice.model.FailureKind;
import com.syncnest.accountservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.io.IOException;
import java.util.Comparator;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private static final String VALIDATION_TYPE = FailureKind.VALIDATION_ERROR.type();

    private final ErrorResponseWriter writer;

    // ---------- Domain exceptions that escaped a service ----------

    @ExceptionHandler(ApiException.class)
    public void handleApiException(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull ApiException ex) throws IOException {
        FailureKind kind = ex.getKind();
        if (ex.isOperational()) {
            log.error("Operational failure: {}", ex.getMessage(), ex);
        } else {
            log.debug("ApiException: code={}, detail={}", ex.code(), ex.getMessage());
        }
        // the exception message may name internal keys; clients get the stable text
        writer.write(req, resp, kind.getStatus(), kind.type(), kind.getTitle(), kind.getDefaultMessage());
    }

    // ---------- Validation & request-shape errors ----------

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public void handleMethodArgumentNotValid(@NonNull HttpServletRequest req,
                                             @NonNull HttpServletResponse resp,
                                             @NonNull MethodArgumentNotValidException ex) throws IOException {
        var details = ex.getBindingResult().getFieldErrors().stream()
                .sorted(Comparator.comparing(FieldError::getField))
                .map(fe -> fe.getDefaultMessage() != null ? fe.getDefaultMessage() : fe.getField() + ": invalid")
                .distinct()
                .limit(5)
                .collect(Collectors.joining("; "));
        writer.write(req, resp, HttpStatus.UNPROCESSABLE_ENTITY, VALIDATION_TYPE,
                "Validation Error",
                details.isBlank() ? "Request validation failed." : details);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public void handleConstraintViolation(@NonNull HttpServletRequest req,
                                          @NonNull HttpServletResponse resp,
                                          @NonNull ConstraintViolationException ex) throws IOException {
        var details = ex.getConstraintViolations().stream()
                .limit(5)
                .map(cv -> cv.getPropertyPath() + ": " + cv.getMessage())
                .collect(Collectors.joining("; "));
        writer.write(req, resp, HttpStatus.UNPROCESSABLE_ENTITY, VALIDATION_TYPE,
                "Validation Error",
                details.isBlank() ? "Request validation failed." : details);
    }

    @ExceptionHandler({ MissingServletRequestParameterException.class, HttpMessageNotReadableException.class })
    public void handleBadRequest(@NonNull HttpServletRequest req,
                                 @NonNull HttpServletResponse resp,
                                 @NonNull Exception ex) throws IOException {
        writer.write(req, resp, HttpStatus.BAD_REQUEST,
                "https://syncnest.dev/problems/bad-request",
                "Bad Request",
                "Malformed or missing request parameters.");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public void handleTypeMismatch(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull MethodArgumentTypeMismatchException ex) throws IOException {
        writer.write(req, resp, HttpStatus.BAD_REQUEST,
                "https://syncnest.dev/problems/type-mismatch",
                "Type Mismatch",
                "Parameter '" + ex.getName() + "' has invalid type.");
    }

    // ---------- HTTP mapping errors ----------

    @ExceptionHandler(NoResourceFoundException.class)
    public void handleNoResource(@NonNull HttpServletRequest req,
                                 @NonNull HttpServletResponse resp,
                                 @NonNull NoResourceFoundException ex) throws IOException {
        writer.write(req, resp, HttpStatus.NOT_FOUND,
                "https://syncnest.dev/problems/not-found",
                "Not Found",
                "No handler for " + req.getRequestURI());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public void handleMethodNotAllowed(@NonNull HttpServletRequest req,
                                       @NonNull HttpServletResponse resp,
                                       @NonNull HttpRequestMethodNotSupportedException ex) throws IOException {
        writer.write(req, resp, HttpStatus.METHOD_NOT_ALLOWED,
                "https://syncnest.dev/problems/method-not-allowed",
                "Method Not Allowed",
                "HTTP method not supported for this endpoint.");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public void handleUnsupportedMediaType(@NonNull HttpServletRequest req,
                                           @NonNull HttpServletResponse resp,
                                           @NonNull HttpMediaTypeNotSupportedException ex) throws IOException {
        writer.write(req, resp, HttpStatus.UNSUPPORTED_MEDIA_TYPE,
                "https://syncnest.dev/problems/unsupported-media-type",
                "Unsupported Media Type",
                "Content type is not supported.");
    }

    // ---------- Data layer ----------

    @ExceptionHandler(DataIntegrityViolationException.class)
    public void handleDataIntegrity(@NonNull HttpServletRequest req,
                                    @NonNull HttpServletResponse resp,
                                    @NonNull DataIntegrityViolationException ex) throws IOException {
        log.debug("DataIntegrityViolation: {}", ex.getMostSpecificCause().getMessage());
        writer.write(req, resp, HttpStatus.CONFLICT,
                "https://syncnest.dev/problems/conflict",
                "Conflict",
                "A conflicting resource already exists or violates a constraint.");
    }

    /** Store connectivity (Redis, database) is never retried here; the request fails opaquely. */
    @ExceptionHandler(DataAccessException.class)
    public void handleDataAccess(@NonNull HttpServletRequest req,
                                 @NonNull HttpServletResponse resp,
                                 @NonNull DataAccessException ex) throws IOException {
        log.error("Data store failure on {}", req.getRequestURI(), ex);
        FailureKind kind = FailureKind.INTERNAL_ERROR;
        writer.write(req, resp, kind.getStatus(), kind.type(), kind.getTitle(), kind.getDefaultMessage());
    }

    // ---------- Fallback 500 ----------

    @ExceptionHandler(Exception.class)
    public void handleGeneric(@NonNull HttpServletRequest req,
                              @NonNull HttpServletResponse resp,
                              @NonNull Exception ex) throws IOException {
        log.error("Unhandled exception", ex);
        FailureKind kind = FailureKind.INTERNAL_ERROR;
        writer.write(req, resp, kind.getStatus(), kind.type(), kind.getTitle(), kind.getDefaultMessage());
    }
}
