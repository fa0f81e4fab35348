package com.example.vidorchestrator.exceptions;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.net.URI;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders every error of the processing API as an RFC 7807 Problem Detail.
 * Extends ResponseEntityExceptionHandler to reuse Spring's handling of common web exceptions.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String TIMESTAMP_PROPERTY = "timestamp";
    private static final String ERRORS_PROPERTY = "errors";

    // --- Processing Exceptions ---

    @ExceptionHandler(ProcessingValidationException.class)
    public ProblemDetail handleProcessingValidationException(ProcessingValidationException ex, WebRequest request) {
        log.warn("Rejected processing request {}: {}", request.getDescription(false), ex.getReason());
        return problem(HttpStatus.BAD_REQUEST, ex.getReason(), request);
    }

    @ExceptionHandler(DataAccessException.class)
    public ProblemDetail handleDataAccessException(DataAccessException ex, WebRequest request) {
        log.error("Queue store operation failed for request {}: {}", request.getDescription(false), ex.getMessage(), ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE,
                "The processing queue store is temporarily unavailable. Please try again later.", request);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ProblemDetail handleResponseStatusException(ResponseStatusException ex, WebRequest request) {
        log.info("Handling ResponseStatusException for {}: Status={}, Reason={}",
                request.getDescription(false), ex.getStatusCode(), ex.getReason());
        return problem(ex.getStatusCode(), ex.getReason(), request);
    }

    // --- Security and Validation ---

    @ExceptionHandler(AccessDeniedException.class)
    public ProblemDetail handleAccessDeniedException(AccessDeniedException ex, WebRequest request) {
        log.warn("Access Denied for request {}: {}", request.getDescription(false), ex.getMessage());
        return problem(HttpStatus.FORBIDDEN,
                "Access Denied. You do not have sufficient permissions to access this resource.", request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ProblemDetail handleConstraintViolationException(ConstraintViolationException ex, WebRequest request) {
        log.warn("Constraint violation for request {}: {}", request.getDescription(false), ex.getMessage());

        Map<String, String> errors = ex.getConstraintViolations().stream()
                .collect(Collectors.toMap(
                        violation -> lastPathSegment(violation.getPropertyPath().toString()),
                        ConstraintViolation::getMessage,
                        (first, second) -> first
                ));

        ProblemDetail problemDetail = problem(HttpStatus.BAD_REQUEST,
                "Input validation failed. Check the 'errors' field for details.", request);
        problemDetail.setProperty(ERRORS_PROPERTY, errors);
        return problemDetail;
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request) {
        log.warn("Request body validation failed for {}: {} errors",
                request.getDescription(false), ex.getErrorCount());
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        ProblemDetail problemDetail = problem(status,
                "Request body validation failed. Check the 'errors' field for details.", request);
        problemDetail.setProperty(ERRORS_PROPERTY, errors);
        return new ResponseEntity<>(problemDetail, headers, status);
    }

    // --- Fallbacks ---
    // Disconnected SSE clients (AsyncRequestNotUsableException) are handled by the base class.

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGenericException(Exception ex, WebRequest request) {
        log.error("Unhandled exception caught by @ExceptionHandler(Exception.class) for request {}:",
                request.getDescription(false), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected internal error occurred. Please try again later or contact support.", request);
    }

    /**
     * Completes ProblemDetails built by the base class (method not allowed, missing parameter...)
     * with a title, instance and timestamp.
     */
    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
            @NonNull Exception ex, @Nullable Object body, @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode statusCode, @NonNull WebRequest request) {

        ProblemDetail problemDetail;
        if (body instanceof ProblemDetail pdBody) {
            problemDetail = pdBody;
            if (problemDetail.getTitle() == null) {
                problemDetail.setTitle(reasonPhrase(statusCode));
            }
            if (problemDetail.getInstance() == null) {
                problemDetail.setInstance(URI.create(request.getDescription(false)));
            }
            Map<String, Object> properties = problemDetail.getProperties();
            if (properties == null || !properties.containsKey(TIMESTAMP_PROPERTY)) {
                problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
            }
        } else {
            log.warn("Creating basic ProblemDetail for exception type {}: {}",
                    ex.getClass().getSimpleName(), ex.getMessage());
            problemDetail = problem(statusCode, ex.getMessage(), request);
        }
        return new ResponseEntity<>(problemDetail, headers, statusCode);
    }

    // --- Helper Methods ---

    private ProblemDetail problem(HttpStatusCode status, String detail, WebRequest request) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setTitle(reasonPhrase(status));
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problemDetail;
    }

    private String lastPathSegment(String propertyPath) {
        if (propertyPath == null || propertyPath.isEmpty()) {
            return "unknown";
        }
        int lastSeparator = Math.max(propertyPath.lastIndexOf('.'), propertyPath.lastIndexOf('['));
        return (lastSeparator == -1) ? propertyPath : propertyPath.substring(lastSeparator + 1);
    }

    private String reasonPhrase(HttpStatusCode statusCode) {
        return statusCode instanceof HttpStatus httpStatus ? httpStatus.getReasonPhrase() : "Status " + statusCode.value();
    }
}
