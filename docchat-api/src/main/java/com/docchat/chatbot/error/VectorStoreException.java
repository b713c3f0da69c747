package com.docchat.chatbot.error;

public class VectorStoreException extends ChatbotException {

    public VectorStoreException(String message) {
        super(ErrorKind.STORE, message);
    }

    public VectorStoreException(String message, Throwable cause) {
        super(ErrorKind.STORE, message, cause);
    }
}
