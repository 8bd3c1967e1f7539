package com.di.suitesplit.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions escaping the controllers to a structured {@link ErrorResponse}.
 *
 * <p>Configuration and validation problems are the caller's fault (400); anything else is a 500.
 * Missing history never reaches this handler: the partitioner degrades to round-robin instead.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException e, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, e, request);
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleValidation(Exception e, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, e, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e, HttpServletRequest request) {
        ResponseEntity<ErrorResponse> response = respond(HttpStatus.BAD_REQUEST, e, request);
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            response.getBody().getDetails().put(fieldError.getField(), fieldError.getDefaultMessage());
        }
        response.getBody().setMessage("Request validation failed");
        return response;
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception e, HttpServletRequest request) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e, request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, Exception e, HttpServletRequest request) {
        ErrorCategory category = ErrorCategory.categorize(e);
        if (status.is5xxServerError()) {
            log.error("Unhandled exception: {} [{}]", e.getClass().getSimpleName(), category.getName(), e);
        } else {
            log.warn("Rejected request {}: {} [{}]", request.getRequestURI(), e.getMessage(), category.getName());
        }
        ErrorResponse body = new ErrorResponse();
        body.setTimestamp(Instant.now().toString());
        body.setStatus(status.value());
        body.setError(status.getReasonPhrase());
        body.setMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        body.setErrorCategory(category.name());
        body.setErrorCategoryDescription(category.getDescription());
        body.setPath(request.getRequestURI());
        body.getDetails().put("exceptionType", e.getClass().getName());
        return ResponseEntity.status(status).body(body);
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
        private String errorCategoryDescription;
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();

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
    }
}
