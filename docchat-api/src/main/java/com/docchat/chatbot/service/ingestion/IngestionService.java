package com.docchat.chatbot.service.ingestion;

import reactor.core.publisher.Mono;

import java.util.List;

public interface IngestionService {

    /**
     * Chunks, embeds and indexes one document. Failures are reported in the result, never thrown.
     */
    IngestionResult ingest(SourceDocument document);

    /**
     * Ingests documents concurrently. Results keep the input order and one failure does not stop the others.
     */
    Mono<IngestionBatchSummary> ingestAll(List<SourceDocument> documents);

    /**
     * Extracts and ingests uploaded files, each one reported on its own.
     */
    Mono<IngestionBatchSummary> ingestDocuments(List<IngestDocumentCommand> commands);

    IngestionResult ingestText(IngestTextCommand command);
}
