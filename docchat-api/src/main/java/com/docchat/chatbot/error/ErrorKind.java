package com.docchat.chatbot.error;

import org.springframework.http.HttpStatus;

public enum ErrorKind {
    VALIDATION(HttpStatus.BAD_REQUEST),
    EXTRACTION(HttpStatus.UNPROCESSABLE_ENTITY),
    EMBEDDING(HttpStatus.BAD_GATEWAY),
    STORE(HttpStatus.SERVICE_UNAVAILABLE),
    SYNTHESIS(HttpStatus.INTERNAL_SERVER_ERROR),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }

    /**
     * Whether a whole-document retry can reasonably succeed after this kind of failure.
     */
    public boolean transientFailure() {
        return this == EMBEDDING || this == STORE;
    }
}
