package com.docchat.chatbot.service.orchestration;

import com.docchat.chatbot.model.RetrievedChunk;

import java.util.List;

public record LlmRequest(String systemPrompt,
                         String question,
                         List<RetrievedChunk> context) {
}
