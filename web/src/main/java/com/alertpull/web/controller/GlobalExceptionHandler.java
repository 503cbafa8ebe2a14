/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.web.controller;

import com.alertpull.common.exception.AlertPullException;
import com.alertpull.common.exception.ConfigurationException;
import com.alertpull.common.exception.DecodeException;
import com.alertpull.common.exception.TransportException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the exception hierarchy onto JSON error bodies:
 * configuration and decode errors are 400, transport errors 502, anything else 500.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AlertPullException.class)
    public ResponseEntity<Map<String, Object>> handleAlertPull(AlertPullException ex, HttpServletRequest request) {
        HttpStatus status = resolveStatus(ex);
        if (status.is5xxServerError()) {
            log.error("{} at {} {}: {}", ex.getErrorCode(), request.getMethod(), request.getRequestURI(),
                    ex.getMessage(), ex);
        } else {
            log.warn("{} at {} {}: {}", ex.getErrorCode(), request.getMethod(), request.getRequestURI(),
                    ex.getMessage());
        }
        return body(status, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex,
                                                                HttpServletRequest request) {
        log.warn("Unreadable request body at {}: {}", request.getRequestURI(), ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "APL_BAD_REQUEST", "Malformed request body", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {} {}: {}", request.getMethod(), request.getRequestURI(),
                ex.getMessage(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "APL_INTERNAL",
                ex.getMessage() != null ? ex.getMessage() : "An unexpected error occurred", request);
    }

    private HttpStatus resolveStatus(AlertPullException ex) {
        if (ex instanceof ConfigurationException || ex instanceof DecodeException) return HttpStatus.BAD_REQUEST;
        if (ex instanceof TransportException) return HttpStatus.BAD_GATEWAY;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message,
                                                     HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", code);
        body.put("message", message);
        body.put("path", request.getRequestURI());
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
