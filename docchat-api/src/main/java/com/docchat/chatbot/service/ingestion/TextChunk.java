package com.docchat.chatbot.service.ingestion;

/**
 * Ordered fragment of a document. {@code start} and {@code end} delimit the text within the source, end exclusive.
 */
public record TextChunk(String id,
                        String documentId,
                        int index,
                        String text,
                        int start,
                        int end,
                        String source,
                        OriginType originType,
                        DocumentMetadata metadata) {
}
