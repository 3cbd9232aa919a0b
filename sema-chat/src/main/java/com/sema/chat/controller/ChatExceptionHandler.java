package com.sema.chat.controller;

import com.sema.chat.dto.ErrorResponse;
import com.sema.chat.exception.ChatValidationException;
import com.sema.chat.exception.GenerationException;
import com.sema.chat.exception.ModelLoadException;
import com.sema.chat.exception.ModelNotLoadedException;
import com.sema.chat.exception.SessionNotFoundException;
import com.sema.chat.exception.StreamCapacityException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Maps the chat error taxonomy onto HTTP statuses and {@link ErrorResponse} bodies.
 */
@RestControllerAdvice
@Slf4j
public class ChatExceptionHandler {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    @ExceptionHandler(ChatValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ChatValidationException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "validation_error", ex.getMessage(),
                Map.of("field", ex.getField()), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex,
                                                           HttpServletRequest request) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fields.put(error.getField(), error.getDefaultMessage());
        }
        return respond(HttpStatus.BAD_REQUEST, "validation_error", "Request validation failed", fields, request);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "validation_error", ex.getMessage(), null, request);
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSessionNotFound(SessionNotFoundException ex,
                                                               HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "session_not_found", ex.getMessage(),
                Map.of("session_id", ex.getSessionId()), request);
    }

    @ExceptionHandler(StreamCapacityException.class)
    public ResponseEntity<ErrorResponse> handleCapacity(StreamCapacityException ex, HttpServletRequest request) {
        return respond(HttpStatus.TOO_MANY_REQUESTS, "capacity_exceeded", ex.getMessage(),
                Map.of("max_concurrent_streams", ex.getMaxConcurrentStreams()), request);
    }

    @ExceptionHandler({ModelNotLoadedException.class, ModelLoadException.class})
    public ResponseEntity<ErrorResponse> handleNotReady(RuntimeException ex, HttpServletRequest request) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "model_not_available", ex.getMessage(), null, request);
    }

    @ExceptionHandler(GenerationException.class)
    public ResponseEntity<ErrorResponse> handleGeneration(GenerationException ex, HttpServletRequest request) {
        log.error("Generation failed: {}", ex.getMessage(), ex);
        Map<String, Object> details = ex.getUpstreamStatus() == null
                ? null
                : Map.of("upstream_status", ex.getUpstreamStatus());
        return respond(HttpStatus.BAD_GATEWAY, "generation_failed", ex.getMessage(), details, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        // framework errors (unknown path, wrong method) keep their own status
        if (ex instanceof org.springframework.web.ErrorResponse framework) {
            HttpStatus status = HttpStatus.valueOf(framework.getStatusCode().value());
            return respond(status, "request_error", ex.getMessage(), null, request);
        }
        log.error("Unhandled error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error", null, request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                  Map<String, Object> details, HttpServletRequest request) {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        if (status.is4xxClientError()) {
            log.warn("{} {} -> {}: {}", request.getMethod(), request.getRequestURI(), status.value(), message);
        }
        return ResponseEntity.status(status)
                .header(REQUEST_ID_HEADER, requestId)
                .body(ErrorResponse.of(error, message, details, requestId));
    }
}
