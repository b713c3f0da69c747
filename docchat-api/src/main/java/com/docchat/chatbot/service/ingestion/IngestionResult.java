package com.docchat.chatbot.service.ingestion;

import com.docchat.chatbot.error.ChatbotException;
import com.docchat.chatbot.error.ErrorKind;

/**
 * Outcome of indexing one document. {@code errorKind} and {@code detail} are only set for {@link Status#FAILED}.
 */
public record IngestionResult(String documentId,
                              String source,
                              int chunks,
                              Status status,
                              ErrorKind errorKind,
                              String detail,
                              int attempts) {

    public enum Status {
        INDEXED,
        EMPTY,
        FAILED
    }

    public static IngestionResult indexed(SourceDocument document, int chunks, int attempts) {
        return new IngestionResult(document.id(), document.source(), chunks, Status.INDEXED, null, null, attempts);
    }

    public static IngestionResult empty(SourceDocument document) {
        return new IngestionResult(document.id(), document.source(), 0, Status.EMPTY, null, null, 0);
    }

    public static IngestionResult failed(String documentId, String source, ErrorKind kind, String detail, int attempts) {
        return new IngestionResult(documentId, source, 0, Status.FAILED, kind, detail, attempts);
    }

    public boolean failed() {
        return status == Status.FAILED;
    }

    /**
     * Rethrows a failed outcome as the exception of its kind, for callers that answer a single document.
     */
    public IngestionResult orThrow() {
        if (failed()) {
            throw new ChatbotException(errorKind == null ? ErrorKind.INTERNAL : errorKind, detail);
        }
        return this;
    }
}
