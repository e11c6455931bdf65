/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.web.controller;

import com.agentruntime.common.exception.AgentRuntimeException;
import com.agentruntime.common.exception.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps failures raised before a response started to JSON error bodies:
 * <pre>
 * { "status": 400, "error": {"code": "ART_VALIDATION", "message": "..."}, "path": "/process", "timestamp": "..." }
 * </pre>
 * Failures inside an event stream never reach this class; they end the
 * stream with a failed envelope.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex, HttpServletRequest request) {
        log.warn("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex,
                                                                HttpServletRequest request) {
        log.warn("Unreadable body on {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "ART_VALIDATION", "Invalid request format", request);
    }

    @ExceptionHandler(AgentRuntimeException.class)
    public ResponseEntity<Map<String, Object>> handleRuntime(AgentRuntimeException ex, HttpServletRequest request) {
        log.error("Request {} {} failed: {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage(), request);
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message,
                                                     HttpServletRequest request) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", code);
        error.put("message", message);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", error);
        body.put("path", request.getRequestURI());
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
    }
}
