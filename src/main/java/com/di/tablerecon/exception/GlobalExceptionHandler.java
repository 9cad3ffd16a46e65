package com.di.tablerecon.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.sql.SQLException;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions that escape the REST layer to a structured {@link ErrorResponse}.
 *
 * <p>Status mapping:
 * <ul>
 *   <li>400: request validation ({@link MethodArgumentNotValidException}, {@link IllegalArgumentException})</li>
 *   <li>422: the request cannot be answered for these datasets (target unavailable, key or column errors)</li>
 *   <li>502: the warehouse failed (query failure or timeout, catalog unavailable)</li>
 *   <li>500: anything else</li>
 * </ul>
 * Failures inside a reconciliation run never get here; they are part of the report.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e, HttpServletRequest request) {
        ErrorResponse response = buildErrorResponse(ErrorCategory.VALIDATION_ERROR, e, HttpStatus.BAD_REQUEST, request);
        response.setMessage("Request validation failed");
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        e.getBindingResult().getGlobalErrors()
                .forEach(error -> fields.putIfAbsent(error.getObjectName(), error.getDefaultMessage()));
        response.addDetail("fieldErrors", fields);
        log.warn("[API] Invalid request {}: {}", response.getPath(), fields);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(Exception e, HttpServletRequest request) {
        logError(ErrorCategory.VALIDATION_ERROR, e, false);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(buildErrorResponse(ErrorCategory.VALIDATION_ERROR, e, HttpStatus.BAD_REQUEST, request));
    }

    @ExceptionHandler({TargetUnavailableException.class, NoCommonKeyException.class, KeyColumnNotFoundException.class,
            EmptyKeySetException.class, ColumnNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleUnprocessable(ReconciliationException e, HttpServletRequest request) {
        return reconciliationError(e, HttpStatus.UNPROCESSABLE_ENTITY, request);
    }

    @ExceptionHandler({QueryExecutionException.class, MetadataUnavailableException.class})
    public ResponseEntity<ErrorResponse> handleWarehouseFailure(ReconciliationException e, HttpServletRequest request) {
        return reconciliationError(e, HttpStatus.BAD_GATEWAY, request);
    }

    /**
     * Catch-all.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e, HttpServletRequest request) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError(category, e, true);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR, request));
    }

    private ResponseEntity<ErrorResponse> reconciliationError(ReconciliationException e, HttpStatus status,
                                                              HttpServletRequest request) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError(category, e, status.is5xxServerError());
        ErrorResponse response = buildErrorResponse(category, e, status, request);
        response.addDetail("failureKind", e.kind().name());
        if (e.getDataset() != null) {
            response.addDetail("dataset", e.getDataset());
        }
        if (e.getColumn() != null) {
            response.addDetail("column", e.getColumn());
        }
        if (!e.getKeyColumns().isEmpty()) {
            response.addDetail("keyColumns", e.getKeyColumns());
        }
        if (e instanceof QueryExecutionException q) {
            response.addDetail("timedOut", q.isTimedOut());
        }
        return ResponseEntity.status(status).body(response);
    }

    private void logError(ErrorCategory category, Throwable exception, boolean withStackTrace) {
        Throwable rootCause = getRootCause(exception);
        String sqlState = rootCause instanceof SQLException sql ? sql.getSQLState() : null;
        if (withStackTrace) {
            log.error("[API] {} [{}] reconciliationId={} sqlState={}: {}", exception.getClass().getSimpleName(),
                    category.getName(), MDC.get("reconciliationId"), sqlState, exception.getMessage(), exception);
        } else {
            log.warn("[API] {} [{}]: {}", exception.getClass().getSimpleName(), category.getName(),
                    exception.getMessage());
        }
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status,
                                             HttpServletRequest request) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(request != null ? request.getRequestURI() : "/unknown");

        response.addDetail("exceptionType", exception.getClass().getName());
        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
    }

    /**
     * Structured error response for API endpoints.
     */
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String errorCategoryDescription;
        private String path;
        private Map<String, Object> details = new HashMap<>();

        public String getTimestamp() {
            return timestamp;
        }

        public void setTimestamp(String timestamp) {
            this.timestamp = timestamp;
        }

        public int getStatus() {
            return status;
        }

        public void setStatus(int status) {
            this.status = status;
        }

        public String getError() {
            return error;
        }

        public void setError(String error) {
            this.error = error;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }

        public String getErrorCategory() {
            return errorCategory;
        }

        public void setErrorCategory(String errorCategory) {
            this.errorCategory = errorCategory;
        }

        public String getErrorCategoryName() {
            return errorCategoryName;
        }

        public void setErrorCategoryName(String errorCategoryName) {
            this.errorCategoryName = errorCategoryName;
        }

        public String getErrorCategoryDescription() {
            return errorCategoryDescription;
        }

        public void setErrorCategoryDescription(String errorCategoryDescription) {
            this.errorCategoryDescription = errorCategoryDescription;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public Map<String, Object> getDetails() {
            return details;
        }

        public void setDetails(Map<String, Object> details) {
            this.details = details;
        }

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
