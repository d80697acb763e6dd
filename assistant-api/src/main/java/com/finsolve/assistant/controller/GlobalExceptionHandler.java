package com.finsolve.assistant.controller;

import com.finsolve.assistant.exception.ChatException;
import com.finsolve.assistant.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ChatException.class)
    public ResponseEntity<Map<String, Object>> handleChatException(ChatException exception) {
        if (exception.status().is5xxServerError()) {
            log.error("Request failed with {}: {}", exception.code(), exception.getMessage(), exception);
        }
        return ResponseEntity.status(exception.status())
                .body(Map.of(
                        "error", exception.getMessage(),
                        "code", exception.code().name()
                ));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBindException(WebExchangeBindException exception) {
        String detail = exception.getFieldErrors().stream()
                .map(this::describe)
                .collect(Collectors.joining("; "));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of(
                        "error", detail.isEmpty() ? "Invalid request" : detail,
                        "code", ErrorCode.VALIDATION_FAILED.name()
                ));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInputException(ServerWebInputException exception) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of(
                        "error", exception.getReason() == null ? "Malformed request" : exception.getReason(),
                        "code", ErrorCode.VALIDATION_FAILED.name()
                ));
    }

    private String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
