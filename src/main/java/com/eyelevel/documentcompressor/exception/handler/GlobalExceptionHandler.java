package com.eyelevel.documentcompressor.exception.handler;

import com.eyelevel.documentcompressor.dto.common.ApiResponse;
import com.eyelevel.documentcompressor.exception.DocumentNotFoundException;
import com.eyelevel.documentcompressor.exception.DocumentValidationException;
import com.eyelevel.documentcompressor.exception.DuplicateJobException;
import com.eyelevel.documentcompressor.exception.IllegalDocumentStateException;
import com.eyelevel.documentcompressor.exception.IllegalJobTransitionException;
import com.eyelevel.documentcompressor.exception.UnknownDocumentTypeException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A centralized exception handler for the entire application.
 * It converts exceptions thrown from controllers into the standardized ApiResponse format
 * with the semantically correct HTTP status code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // --- 4xx Client Error Handlers ---

    /**
     * Handles malformed document metadata, invalid policies and unknown document types. (400 Bad Request)
     */
    @ExceptionHandler({DocumentValidationException.class, UnknownDocumentTypeException.class})
    public ResponseEntity<ApiResponse<Object>> handleBadRequest(RuntimeException ex) {
        log.warn("Bad Request Exception: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ApiResponse.error(ex.getMessage()));
    }

    /**
     * Handles malformed JSON or unreadable request bodies. (400 Bad Request)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST,
                ApiResponse.error("Malformed request body.", "The request body is missing or could not be parsed."));
    }

    /**
     * Handles missing required request parameters. (400 Bad Request)
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Object>> handleMissingServletRequestParameter(MissingServletRequestParameterException ex) {
        String errorMessage = String.format("Required parameter '%s' of type '%s' is missing.", ex.getParameterName(),
                ex.getParameterType());
        log.warn("Handling MissingServletRequestParameterException: {}", errorMessage);
        return build(HttpStatus.BAD_REQUEST, ApiResponse.error("Required parameter is missing.", errorMessage));
    }

    /**
     * Handles validation errors from @Valid on request bodies. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> String.format("'%s': %s", error.getField(), error.getDefaultMessage()))
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling validation exception: {}", errorMessage);
        return build(HttpStatus.BAD_REQUEST, ApiResponse.error("Invalid input provided.", errorMessage));
    }

    /**
     * Handles validation errors from @Validated on path variables and request parameters. (400 Bad Request)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        String errors = ex.getConstraintViolations().stream()
                .map(violation -> {
                    String path = violation.getPropertyPath().toString();
                    return String.format("'%s': %s", path.substring(path.lastIndexOf('.') + 1), violation.getMessage());
                })
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling constraint violation exception: {}", errorMessage);
        return build(HttpStatus.BAD_REQUEST, ApiResponse.error("Invalid input provided.", errorMessage));
    }

    /**
     * Handles type mismatch errors for path variables or request parameters (e.g., a malformed UUID). (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String errorMessage = String.format("Invalid value '%s' for parameter '%s'. Expected type '%s'.", ex.getValue(),
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName()
                        : String.valueOf(ex.getRequiredType()));
        log.warn("Handling type mismatch exception: {}", errorMessage);
        return build(HttpStatus.BAD_REQUEST, ApiResponse.error("Invalid parameter type provided.", errorMessage));
    }

    /**
     * Handles missing documents, jobs and types. (404 Not Found)
     */
    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNotFound(DocumentNotFoundException ex) {
        log.warn("Resource Not Found Exception: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, ApiResponse.error(ex.getMessage()));
    }

    /**
     * Handles unsupported HTTP methods for an existing endpoint. (405 Method Not Allowed)
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpRequestMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        String supportedMethods = String.join(", ", Objects.requireNonNullElse(ex.getSupportedMethods(), new String[0]));
        String errorMessage = String.format("Request method '%s' not supported. Supported methods are: %s",
                ex.getMethod(), supportedMethods);
        log.warn("Handling HttpRequestMethodNotSupportedException: {}", errorMessage);
        return build(HttpStatus.METHOD_NOT_ALLOWED, ApiResponse.error("Method not allowed.", errorMessage));
    }

    /**
     * Handles duplicate jobs and transitions the current state does not allow. (409 Conflict)
     */
    @ExceptionHandler({DuplicateJobException.class, IllegalJobTransitionException.class,
            IllegalDocumentStateException.class})
    public ResponseEntity<ApiResponse<Object>> handleConflict(RuntimeException ex) {
        log.warn("Conflict Exception: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, ApiResponse.error(ex.getMessage()));
    }

    // --- 5xx Server Error Handlers ---

    /**
     * Handles persistence failures. (500 Internal Server Error)
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiResponse<Object>> handleDataAccess(DataAccessException ex) {
        log.error("Persistence failure while handling request.", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR,
                ApiResponse.error("The request could not be stored. Please try again.", ex.getClass().getSimpleName()));
    }

    /**
     * A final catch-all handler for any other unexpected exceptions. (500 Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(Exception ex) {
        log.error("An unexpected internal server error occurred", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ApiResponse.error(
                "An unexpected internal error occurred. Please contact support.", ex.getClass().getSimpleName()));
    }

    private ResponseEntity<ApiResponse<Object>> build(HttpStatus status, ApiResponse<Object> body) {
        ApiResponse<Object> response = ApiResponse.builder()
                .displayMessage(body.getDisplayMessage())
                .error(body.getError())
                .showMessage(body.getShowMessage())
                .statusCode(status.value())
                .build();
        return new ResponseEntity<>(response, status);
    }
}
