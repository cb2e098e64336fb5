package com.phillippitts.council.presentation.exception;

import com.phillippitts.council.exception.AdmissionDeniedException;
import com.phillippitts.council.exception.ConfigurationException;
import com.phillippitts.council.exception.PipelineFailureException;
import jakarta.validation.ConstraintViolationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts council exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping provider details away from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Budget exhausted - retry after the budget resets (HTTP 429).
     */
    @ExceptionHandler(AdmissionDeniedException.class)
    ResponseEntity<ApiError> handleAdmissionDenied(AdmissionDeniedException ex) {
        LOG.warn("Admission denied: scope={}, spent={}, limit={}", ex.getScope(), ex.getSpent(), ex.getLimit());
        return ResponseEntity
            .status(HttpStatus.TOO_MANY_REQUESTS)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                ex.getScope() + " budget exhausted",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Misconfiguration detected at runtime (HTTP 503).
     */
    @ExceptionHandler(ConfigurationException.class)
    ResponseEntity<ApiError> handleConfiguration(ConfigurationException ex) {
        LOG.error("Configuration error: property={}, message={}", ex.getProperty(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Council service unavailable",
                "Invalid configuration. Contact administrator.",
                Instant.now()
            ));
    }

    /**
     * Every backend failed in Stage1 (HTTP 502).
     */
    @ExceptionHandler(PipelineFailureException.class)
    ResponseEntity<ApiError> handlePipelineFailure(PipelineFailureException ex) {
        LOG.error("Deliberation failed: query={}, attempted={}", ex.getQueryId(), ex.getAttemptedBackends());
        return ResponseEntity
            .status(HttpStatus.BAD_GATEWAY)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "No model backend produced a response",
                "Attempted " + ex.getAttemptedCount() + " backends. Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Client error - invalid request body (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .map(e -> e.getField() + ": " + e.getDefaultMessage())
            .collect(Collectors.joining("; "));
        LOG.warn("Invalid request: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("ValidationError", "Invalid request", details, Instant.now()));
    }

    /**
     * Client error - invalid request parameter (HTTP 400).
     */
    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class,
        IllegalArgumentException.class})
    ResponseEntity<ApiError> handleInvalidParameter(RuntimeException ex) {
        LOG.warn("Invalid request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("ValidationError", "Invalid request", ex.getMessage(), Instant.now()));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
