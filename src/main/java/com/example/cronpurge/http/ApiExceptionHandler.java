package com.example.cronpurge.http;

import com.example.cronpurge.compiler.JobCompilerException;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badReq(IllegalArgumentException ex) {
        String message = ex.getMessage() != null ? ex.getMessage() : "BAD_REQUEST";
        return ResponseEntity.badRequest().body(Map.of("code", "BAD_REQUEST", "message", message));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(Map.of("code", "VALIDATION_FAILED", "message", message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadableBody(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest()
                .body(Map.of("code", "MALFORMED_REQUEST", "message", "Request body could not be read"));
    }

    @ExceptionHandler(JobCompilerException.class)
    public ResponseEntity<Map<String, Object>> domainError(JobCompilerException ex) {
        HttpStatus status = switch (ex.getCode()) {
            case INVALID_CRON_FORMAT, MISSING_FILTERS, INVALID_IDENTIFIER -> HttpStatus.BAD_REQUEST;
            case JOB_NOT_FOUND -> HttpStatus.NOT_FOUND;
        };

        return ResponseEntity.status(status)
                .body(Map.of(
                        "code", ex.getCode().name(),
                        "message", ex.getMessage()
                ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> boom(Exception ex) {
        log.error("Unexpected error handling request", ex);
        String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("code", "INTERNAL_ERROR", "message", message));
    }
}
