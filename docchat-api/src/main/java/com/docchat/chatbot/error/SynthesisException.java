package com.docchat.chatbot.error;

public class SynthesisException extends ChatbotException {

    public SynthesisException(String message) {
        super(ErrorKind.SYNTHESIS, message);
    }

    public SynthesisException(String message, Throwable cause) {
        super(ErrorKind.SYNTHESIS, message, cause);
    }
}
