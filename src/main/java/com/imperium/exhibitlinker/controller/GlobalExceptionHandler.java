package com.imperium.exhibitlinker.controller;

import com.imperium.exhibitlinker.config.RunIdSupport;
import com.imperium.exhibitlinker.exception.LinkerException;
import com.imperium.exhibitlinker.exception.SanitizationConflictException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.HashMap;
import java.util.Map;

/**
 * 统一错误结构：{"error": {"code", "message", "requestId", "details"}}。
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getDefaultMessage())
                .orElse("Validation failed");
        String field = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getField())
                .orElse(null);
        return error(HttpStatus.BAD_REQUEST, LinkerException.INVALID_ARGUMENT, message,
                field != null ? Map.of("field", field) : null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, LinkerException.INVALID_ARGUMENT, "Malformed request body", null);
    }

    @ExceptionHandler(SanitizationConflictException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(SanitizationConflictException ex) {
        return error(HttpStatus.CONFLICT, ex.getCode(), ex.getMessage(), Map.of("conflicts", ex.getConflicts()));
    }

    @ExceptionHandler(LinkerException.class)
    public ResponseEntity<Map<String, Object>> handleLinker(LinkerException ex) {
        HttpStatus status = statusOf(ex.getCode());
        if (status.is5xxServerError()) {
            log.error("Run failed [{}]: {}", ex.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("Request rejected [{}]: {}", ex.getCode(), ex.getMessage());
        }
        return error(status, ex.getCode(), ex.getMessage(), null);
    }

    static HttpStatus statusOf(String code) {
        return switch (code) {
            case LinkerException.INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
            case LinkerException.SOURCE_UNREADABLE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case LinkerException.SANITIZATION_CONFLICT -> HttpStatus.CONFLICT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message,
            Map<String, Object> details) {
        Map<String, Object> err = new HashMap<>();
        err.put("code", code);
        err.put("message", message);
        err.put("requestId", resolveRequestId());
        if (details != null) {
            err.put("details", details);
        }
        return ResponseEntity.status(status).body(Map.of("error", err));
    }

    private static String resolveRequestId() {
        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            return RunIdSupport.newRunId();
        }
        HttpServletRequest request = attributes.getRequest();
        return RunIdSupport.resolve(request);
    }
}
