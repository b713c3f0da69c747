package com.docchat.chatbot.service.ingestion;

import java.io.InputStream;
import java.util.List;

public interface DocumentTextExtractor {

    List<String> SUPPORTED_EXTENSIONS = List.of(".pdf", ".docx", ".csv", ".txt");

    /**
     * Plain text and metadata of a document. Fails with {@link com.docchat.chatbot.error.ExtractionException}
     * when the content cannot be parsed.
     */
    ExtractedDocument extract(String filename, InputStream inputStream);

    record ExtractedDocument(DocumentMetadata metadata, String text) {}
}
