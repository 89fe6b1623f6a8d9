package com.restaurant.analytics.api;

import com.restaurant.analytics.domain.exception.InvalidFilterValueException;
import com.restaurant.analytics.domain.exception.InvalidSelectionException;
import com.restaurant.analytics.domain.exception.QueryExecutionException;
import com.restaurant.analytics.domain.exception.QueryValidationException;
import com.restaurant.analytics.domain.exception.UnknownFilterKeyException;
import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps domain exceptions to HTTP responses.
 *
 * Validation errors are caller mistakes (400) and carry the details needed
 * to fix the request; wrong method or content type get 405 and 415.
 * Execution failures are 500 without database details.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidSelectionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSelection(InvalidSelectionException e) {
        return badRequest(ErrorResponse.builder()
                .error("invalid_selection")
                .message(e.getMessage())
                .invalidMetrics(e.getInvalidMetrics())
                .invalidDimensions(e.getInvalidDimensions()));
    }

    @ExceptionHandler(InvalidFilterValueException.class)
    public ResponseEntity<ErrorResponse> handleInvalidFilterValue(InvalidFilterValueException e) {
        return badRequest(ErrorResponse.builder()
                .error("invalid_filter_value")
                .message(e.getMessage())
                .filterKey(e.getFilterKey()));
    }

    @ExceptionHandler(UnknownFilterKeyException.class)
    public ResponseEntity<ErrorResponse> handleUnknownFilterKey(UnknownFilterKeyException e) {
        return badRequest(ErrorResponse.builder()
                .error("unknown_filter_key")
                .message(e.getMessage())
                .unknownKeys(e.getUnknownKeys()));
    }

    @ExceptionHandler(QueryValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(QueryValidationException e) {
        return badRequest(ErrorResponse.builder()
                .error("invalid_request")
                .message(e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return badRequest(ErrorResponse.builder()
                .error("invalid_request")
                .message("Malformed request body"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return badRequest(ErrorResponse.builder()
                .error("invalid_request")
                .message("Invalid value for parameter '" + e.getName() + "'"));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        return badRequest(ErrorResponse.builder()
                .error("invalid_request")
                .message("Missing parameter '" + e.getParameterName() + "'"));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        log.warn("Unsupported method: {}", e.getMethod());
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(ErrorResponse.builder()
                .error("method_not_allowed")
                .message(e.getMessage())
                .timestamp(System.currentTimeMillis())
                .build());
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaTypeNotSupported(HttpMediaTypeNotSupportedException e) {
        log.warn("Unsupported content type: {}", e.getContentType());
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE).body(ErrorResponse.builder()
                .error("unsupported_media_type")
                .message(e.getMessage())
                .timestamp(System.currentTimeMillis())
                .build());
    }

    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<ErrorResponse> handleExecution(QueryExecutionException e) {
        log.error("Query execution failure", e);
        return executionFailure();
    }

    // Metadata and quick-insights reach storage through repositories, not the executor
    @ExceptionHandler({DataAccessException.class, PersistenceException.class, TransactionException.class})
    public ResponseEntity<ErrorResponse> handleStorageFailure(RuntimeException e) {
        log.error("Storage failure", e);
        return executionFailure();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unexpected exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.builder()
                .error("internal_error")
                .message("Internal server error")
                .timestamp(System.currentTimeMillis())
                .build());
    }

    private static ResponseEntity<ErrorResponse> executionFailure() {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.builder()
                .error("execution_failure")
                .message("Query execution failed")
                .timestamp(System.currentTimeMillis())
                .build());
    }

    private static ResponseEntity<ErrorResponse> badRequest(ErrorResponse.ErrorResponseBuilder builder) {
        ErrorResponse response = builder.timestamp(System.currentTimeMillis()).build();
        log.warn("Bad request: {}", response.getMessage());
        return ResponseEntity.badRequest().body(response);
    }
}
