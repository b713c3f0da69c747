package com.docchat.chatbot.model;

public record Citation(String chunkId,
                       String text,
                       String source,
                       double score) {

    public static Citation of(RetrievedChunk chunk) {
        return new Citation(chunk.chunkId(), chunk.text(), chunk.source(), chunk.score());
    }
}
