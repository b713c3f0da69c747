package com.docchat.chatbot.service.ingestion;

import java.util.Objects;

/**
 * A named unit of plain text waiting to be indexed: an uploaded file after extraction, or a CMS import.
 */
public record SourceDocument(String id,
                             String source,
                             OriginType originType,
                             String text,
                             DocumentMetadata metadata) {

    public SourceDocument {
        Objects.requireNonNull(originType, "originType");
        metadata = metadata == null ? DocumentMetadata.empty() : metadata;
        text = text == null ? "" : text;
    }

    public static SourceDocument of(OriginType originType, String source, String text, DocumentMetadata metadata) {
        return new SourceDocument(DocumentIds.forSource(originType, source), source, originType, text, metadata);
    }
}
