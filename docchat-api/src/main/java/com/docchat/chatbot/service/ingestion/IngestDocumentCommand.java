package com.docchat.chatbot.service.ingestion;

/**
 * An uploaded file as received, before text extraction.
 */
public record IngestDocumentCommand(String filename,
                                    String contentType,
                                    byte[] bytes) {
}
