package com.docchat.chatbot.error;

public class ExtractionException extends ChatbotException {

    public ExtractionException(String message) {
        super(ErrorKind.EXTRACTION, message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(ErrorKind.EXTRACTION, message, cause);
    }
}
