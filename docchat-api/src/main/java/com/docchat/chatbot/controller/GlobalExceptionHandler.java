package com.docchat.chatbot.controller;

import com.docchat.chatbot.error.ChatbotException;
import com.docchat.chatbot.error.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ChatbotException.class)
    public ResponseEntity<Map<String, Object>> handleChatbotException(ChatbotException exception) {
        if (exception.status().is5xxServerError()) {
            log.error("Request failed with {}: {}", exception.kind(), exception.getMessage());
        } else {
            log.warn("Request rejected with {}: {}", exception.kind(), exception.getMessage());
        }
        String detail = exception.kind() == ErrorKind.INTERNAL ? "Internal server error" : exception.getMessage();
        return body(exception.status(), exception.kind(), detail);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBindException(WebExchangeBindException exception) {
        String detail = exception.getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return body(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION, detail.isEmpty() ? "Invalid request" : detail);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInputException(ServerWebInputException exception) {
        return body(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION, exception.getReason() == null ? "Invalid request" : exception.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception exception) {
        log.error("Unhandled error", exception);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.INTERNAL, "Internal server error");
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, ErrorKind kind, String detail) {
        return ResponseEntity.status(status)
                .body(Map.of(
                        "error", kind.name(),
                        "detail", detail
                ));
    }
}
