package com.example.asyncdemo.exception;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps failures of the combined endpoint to JSON error bodies.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<Map<String, Object>> handleUpstreamException(UpstreamException ex,
                                                                       HttpServletRequest request) {
        log.warn("Upstream failure for id={}: {}", ex.getRequestId(), ex.getMessage());
        return errorResponse(HttpStatus.BAD_GATEWAY, "Upstream service unavailable", request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException ex,
                                                                              HttpServletRequest request) {
        log.warn("Validation error: {}", ex.getMessage());
        return errorResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatchException(MethodArgumentTypeMismatchException ex,
                                                                           HttpServletRequest request) {
        log.warn("Type mismatch error: parameter={}, value={}", ex.getName(), ex.getValue());
        return errorResponse(HttpStatus.BAD_REQUEST,
            String.format("Invalid value '%s' for parameter '%s'", ex.getValue(), ex.getName()), request);
    }

    /**
     * Framework errors (unknown path, wrong method, async timeout, ...) keep
     * the status Spring assigned them.
     */
    @ExceptionHandler({ServletException.class, ErrorResponseException.class, AsyncRequestTimeoutException.class})
    public ResponseEntity<Map<String, Object>> handleFrameworkException(Exception ex, HttpServletRequest request) {
        if (!(ex instanceof ErrorResponse errorResponse)) {
            return handleGenericException(ex, request);
        }
        HttpStatusCode status = errorResponse.getStatusCode();
        if (status.is5xxServerError()) {
            log.error("Request failed with {}: {}", status.value(), ex.getMessage());
        } else {
            log.warn("Request rejected with {}: {}", status.value(), ex.getMessage());
        }
        String message = errorResponse.getBody().getDetail() != null
            ? errorResponse.getBody().getDetail()
            : ex.getMessage();
        return errorResponse(status, message, errorResponse.getHeaders(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", request);
    }

    private static ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message,
                                                                     HttpServletRequest request) {
        return errorResponse(status, message, HttpHeaders.EMPTY, request);
    }

    private static ResponseEntity<Map<String, Object>> errorResponse(HttpStatusCode status, String message,
                                                                     HttpHeaders headers,
                                                                     HttpServletRequest request) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", resolved != null ? resolved.getReasonPhrase() : "Error");
        body.put("message", message);
        body.put("path", request.getRequestURI());
        return ResponseEntity.status(status).headers(headers).body(body);
    }
}
