package com.example.auditcore.http;

import com.example.auditcore.service.AuditCoreException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badReq(IllegalArgumentException ex) {
        return badRequest(ex.getMessage());
    }

    @ExceptionHandler({
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, Object>> malformed(Exception ex) {
        return badRequest(ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalid(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .orElse("invalid request body");
        return badRequest(message);
    }

    @ExceptionHandler(AuditCoreException.class)
    public ResponseEntity<Map<String, Object>> domainError(AuditCoreException ex) {
        HttpStatus status;
        switch (ex.getCode()) {
            case INVALID_SCOPE -> status = HttpStatus.BAD_REQUEST;
            case FORBIDDEN -> status = HttpStatus.FORBIDDEN;
            case EVENT_NOT_FOUND, ROLE_NOT_FOUND, PERMISSION_NOT_FOUND, USER_NOT_FOUND,
                    ROLE_BINDING_NOT_FOUND, PERMISSION_BINDING_NOT_FOUND, GRANT_NOT_FOUND -> status = HttpStatus.NOT_FOUND;
            case INTEGRITY_VIOLATION, ROLE_ALREADY_EXISTS, PERMISSION_ALREADY_EXISTS, ROLE_BINDING_ALREADY_EXISTS,
                    PERMISSION_BINDING_ALREADY_EXISTS, GRANT_ALREADY_EXISTS, RESERVED_ROLE -> status = HttpStatus.CONFLICT;
            case CONFLICTING_APPEND, STORAGE_UNAVAILABLE -> status = HttpStatus.SERVICE_UNAVAILABLE;
            default -> status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (ex.isTransient()) {
            log.warn("Transient failure handling request: {}", ex.getMessage(), ex);
        }

        return ResponseEntity.status(status)
                .body(Map.of(
                        "code", ex.getCode().name(),
                        "message", ex.getMessage()
                ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> boom(Exception ex) {
        log.error("Unexpected error handling request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("code", "INTERNAL_ERROR", "message", String.valueOf(ex.getMessage())));
    }

    private static ResponseEntity<Map<String, Object>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of(
                "code", "BAD_REQUEST",
                "message", message == null ? "bad request" : message));
    }
}
