package com.docchat.chatbot.model;

import java.util.Map;

public record RetrievedChunk(
        String chunkId,
        String documentId,
        String text,
        String source,
        double score,
        Map<String, Object> metadata
) {
}
