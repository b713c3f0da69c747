package com.docchat.chatbot.error;

import org.springframework.http.HttpStatus;

public class ChatbotException extends RuntimeException {

    private final ErrorKind kind;

    public ChatbotException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ChatbotException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public HttpStatus status() {
        return kind.status();
    }
}
