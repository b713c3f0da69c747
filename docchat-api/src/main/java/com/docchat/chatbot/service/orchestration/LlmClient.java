package com.docchat.chatbot.service.orchestration;

public interface LlmClient {

    /**
     * Generated answer text. Fails with {@link com.docchat.chatbot.error.SynthesisException}.
     */
    String generate(LlmRequest request);
}
