package com.docchat.chatbot.error;

public class EmbeddingException extends ChatbotException {

    public EmbeddingException(String message) {
        super(ErrorKind.EMBEDDING, message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(ErrorKind.EMBEDDING, message, cause);
    }
}
