package com.vaultwave.backend.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps pipeline failures to JSON error bodies.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(err ->
                fieldErrors.put(err.getField(), err.getDefaultMessage())
        );
        log.warn("Validation failed: {}", fieldErrors);

        Map<String, Object> body = new HashMap<>();
        body.put("message", "Validation error");
        body.put("errors", fieldErrors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleMalformedBody(HttpMessageNotReadableException ex) {
        log.warn("Malformed request body: {}", ex.getMessage());
        return message(HttpStatus.BAD_REQUEST, "Invalid request body");
    }

    // Missing query parameters and headers
    @ExceptionHandler(ServletRequestBindingException.class)
    public ResponseEntity<Map<String, String>> handleMissingInput(ServletRequestBindingException ex) {
        log.warn("Incomplete request: {}", ex.getMessage());
        return message(HttpStatus.BAD_REQUEST, ex.getBody().getDetail());
    }

    @ExceptionHandler(TypeMismatchException.class)
    public ResponseEntity<Map<String, String>> handleTypeMismatch(TypeMismatchException ex) {
        log.warn("Unparseable request value: {}", ex.getMessage());
        String name = ex.getPropertyName() != null ? ex.getPropertyName() : "value";
        return message(HttpStatus.BAD_REQUEST, "Invalid " + name + ": " + ex.getValue());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Map<String, String>> handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .headers(ex.getHeaders())
                .body(message(HttpStatus.METHOD_NOT_ALLOWED, ex.getBody().getDetail()).getBody());
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<Map<String, String>> handleMediaType(HttpMediaTypeNotSupportedException ex) {
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .headers(ex.getHeaders())
                .body(message(HttpStatus.UNSUPPORTED_MEDIA_TYPE, ex.getBody().getDetail()).getBody());
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<Map<String, String>> handleNoRoute(Exception ex) {
        return message(HttpStatus.NOT_FOUND, "Not found");
    }

    @ExceptionHandler({InvalidPriceException.class, EmptyOrderException.class,
            CurrencyMismatchException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return message(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler({NotEntitledException.class, SecurityException.class})
    public ResponseEntity<Map<String, String>> handleForbidden(RuntimeException ex) {
        log.warn("Access denied: {}", ex.getMessage());
        return message(HttpStatus.FORBIDDEN, ex.getMessage());
    }

    @ExceptionHandler({OrderStateException.class, DownloadNotReadyException.class})
    public ResponseEntity<Map<String, String>> handleConflict(RuntimeException ex) {
        log.warn("State conflict: {}", ex.getMessage());
        return message(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(DownloadExpiredException.class)
    public ResponseEntity<Map<String, String>> handleExpired(DownloadExpiredException ex) {
        log.info("Artifact not available: {}", ex.getMessage());
        return message(HttpStatus.GONE, ex.getMessage());
    }

    @ExceptionHandler(UntrustedEventException.class)
    public ResponseEntity<Map<String, String>> handleUntrusted(UntrustedEventException ex) {
        // Logged at ERROR by the adapter; keep the response opaque
        return message(HttpStatus.BAD_REQUEST, "Event rejected");
    }

    @ExceptionHandler(GatewayUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleGateway(GatewayUnavailableException ex) {
        log.warn("Payment gateway unavailable: {}", ex.getMessage());
        return message(HttpStatus.SERVICE_UNAVAILABLE, "Payment provider unavailable, please try again");
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, String>> handleStatus(ResponseStatusException ex) {
        String reason = ex.getReason() != null ? ex.getReason() : ex.getStatusCode().toString();
        return ResponseEntity.status(ex.getStatusCode()).body(Map.of("message", reason));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnhandled(Exception ex) {
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        return message(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<Map<String, String>> message(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("message", message != null ? message : status.getReasonPhrase()));
    }
}
