package com.docchat.chatbot.service.ingestion;

import com.docchat.chatbot.error.ChatbotException;
import com.docchat.chatbot.error.EmbeddingException;
import com.docchat.chatbot.error.ErrorKind;
import com.docchat.chatbot.error.ValidationException;
import com.docchat.chatbot.error.VectorStoreException;
import com.docchat.chatbot.service.embedding.EmbeddingsClient;
import com.docchat.chatbot.service.vectorstore.DistanceMetric;
import com.docchat.chatbot.service.vectorstore.IndexedPoint;
import com.docchat.chatbot.service.vectorstore.PointPayload;
import com.docchat.chatbot.service.vectorstore.VectorStoreClient;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

@Service
public class DefaultIngestionService implements IngestionService {

    private static final Logger log = LoggerFactory.getLogger(DefaultIngestionService.class);

    private final DocumentTextExtractor textExtractor;
    private final TextChunker textChunker;
    private final EmbeddingsClient embeddingsClient;
    private final VectorStoreClient vectorStoreClient;
    private final Scheduler ingestionScheduler;
    private final MeterRegistry meterRegistry;
    private final Counter chunkCounter;
    private final Timer ingestionTimer;
    private final String collection;
    private final int concurrency;
    private final int maxAttempts;
    private final long backoffMillis;
    private final Map<String, DocumentLock> documentLocks = new ConcurrentHashMap<>();

    public DefaultIngestionService(DocumentTextExtractor textExtractor,
                                   TextChunker textChunker,
                                   EmbeddingsClient embeddingsClient,
                                   VectorStoreClient vectorStoreClient,
                                   @Qualifier("ingestionScheduler") Scheduler ingestionScheduler,
                                   MeterRegistry meterRegistry,
                                   @Value("${docchat.qdrant.collection:documents}") String collection,
                                   @Value("${docchat.ingest.concurrency:4}") int concurrency,
                                   @Value("${docchat.ingest.retry.max-attempts:1}") int maxAttempts,
                                   @Value("${docchat.ingest.retry.backoff-millis:500}") long backoffMillis) {
        this.textExtractor = textExtractor;
        this.textChunker = textChunker;
        this.embeddingsClient = embeddingsClient;
        this.vectorStoreClient = vectorStoreClient;
        this.ingestionScheduler = ingestionScheduler;
        this.meterRegistry = meterRegistry;
        this.chunkCounter = meterRegistry.counter("docchat.ingest.chunks");
        this.ingestionTimer = meterRegistry.timer("docchat.ingest.duration");
        this.collection = collection;
        this.concurrency = Math.max(1, concurrency);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMillis = Math.max(0, backoffMillis);
    }

    @Override
    public IngestionResult ingest(SourceDocument document) {
        if (document == null) {
            return record(IngestionResult.failed(null, null, ErrorKind.VALIDATION, "Document is required", 0));
        }
        DocumentLock lock = acquire(document.id());
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return record(ingestLocked(document));
        } finally {
            sample.stop(ingestionTimer);
            release(document.id(), lock);
        }
    }

    @Override
    public Mono<IngestionBatchSummary> ingestAll(List<SourceDocument> documents) {
        if (documents == null || documents.isEmpty()) {
            return Mono.error(new ValidationException("No documents to ingest"));
        }
        return Flux.fromIterable(documents)
                .flatMapSequential(document -> Mono.fromCallable(() -> ingest(document))
                        .subscribeOn(ingestionScheduler)
                        .onErrorResume(ex -> Mono.just(unexpectedFailure(document.id(), document.source(), ex))), concurrency)
                .collectList()
                .map(IngestionBatchSummary::of)
                .doOnNext(summary -> log.info("Batch ingestion finished: {} indexed, {} empty, {} failed, {} chunks",
                        summary.indexed(), summary.empty(), summary.failed(), summary.chunks()));
    }

    @Override
    public Mono<IngestionBatchSummary> ingestDocuments(List<IngestDocumentCommand> commands) {
        if (commands == null || commands.isEmpty()) {
            return Mono.error(new ValidationException("No file was uploaded"));
        }
        if (commands.size() == 1 && isEmpty(commands.get(0))) {
            return Mono.error(new ValidationException("Uploaded file is empty"));
        }
        return Flux.fromIterable(commands)
                .flatMapSequential(command -> Mono.fromCallable(() -> ingestDocument(command))
                        .subscribeOn(ingestionScheduler)
                        .onErrorResume(ex -> Mono.just(unexpectedFailure(
                                DocumentIds.forSource(OriginType.FILE, command.filename()), command.filename(), ex))), concurrency)
                .collectList()
                .map(IngestionBatchSummary::of);
    }

    @Override
    public IngestionResult ingestText(IngestTextCommand command) {
        if (command == null || command.content() == null || command.content().isBlank()) {
            throw new ValidationException("Content must not be empty");
        }
        String source = command.source() == null || command.source().isBlank() ? "cms" : command.source().trim();
        DocumentMetadata metadata = DocumentMetadata.empty()
                .withCreatedAt(OffsetDateTime.now())
                .withAttributes(command.metadata());
        log.info("Importing CMS content from {}", source);
        return ingest(SourceDocument.of(OriginType.CMS, source, command.content(), metadata));
    }

    IngestionResult ingestDocument(IngestDocumentCommand command) {
        String filename = command.filename() == null || command.filename().isBlank() ? "unknown_file" : command.filename();
        String documentId = DocumentIds.forSource(OriginType.FILE, filename);
        log.info("Processing upload {}", filename);
        try {
            validateUpload(filename, command);
            DocumentTextExtractor.ExtractedDocument extracted;
            try (InputStream inputStream = new ByteArrayInputStream(command.bytes())) {
                extracted = textExtractor.extract(filename, inputStream);
            }
            DocumentMetadata metadata = extracted.metadata()
                    .merge(DocumentMetadata.empty().withContentType(command.contentType()))
                    .withCreatedAt(OffsetDateTime.now());
            return ingest(new SourceDocument(documentId, filename, OriginType.FILE, extracted.text(), metadata));
        } catch (ChatbotException ex) {
            log.warn("Upload {} rejected: {}", filename, ex.getMessage());
            return record(IngestionResult.failed(documentId, filename, ex.kind(), ex.getMessage(), 0));
        } catch (IOException ex) {
            return record(unexpectedFailure(documentId, filename, ex));
        }
    }

    int trackedDocumentLocks() {
        return documentLocks.size();
    }

    private DocumentLock acquire(String documentId) {
        DocumentLock lock = documentLocks.compute(documentId, (id, existing) -> {
            DocumentLock current = existing == null ? new DocumentLock() : existing;
            current.users++;
            return current;
        });
        lock.mutex.lock();
        return lock;
    }

    private void release(String documentId, DocumentLock lock) {
        lock.mutex.unlock();
        // dropped once no thread holds or waits for it
        documentLocks.computeIfPresent(documentId, (id, current) -> --current.users == 0 ? null : current);
    }

    private IngestionResult ingestLocked(SourceDocument document) {
        List<TextChunk> chunks;
        try {
            chunks = textChunker.chunk(document);
        } catch (ChatbotException ex) {
            return IngestionResult.failed(document.id(), document.source(), ex.kind(), ex.getMessage(), 0);
        }
        if (chunks.isEmpty()) {
            log.info("Document {} ({}) produced no chunks", document.source(), document.id());
            return IngestionResult.empty(document);
        }
        for (int attempt = 1; ; attempt++) {
            try {
                index(document, chunks);
                log.info("Ingested document {} ({}) with {} chunks", document.source(), document.id(), chunks.size());
                return IngestionResult.indexed(document, chunks.size(), attempt);
            } catch (ChatbotException ex) {
                if (!ex.kind().transientFailure() || attempt >= maxAttempts) {
                    log.error("Failed to ingest document {} after {} attempt(s): {}", document.source(), attempt, ex.getMessage(), ex);
                    return IngestionResult.failed(document.id(), document.source(), ex.kind(), ex.getMessage(), attempt);
                }
                log.warn("Attempt {} of {} for document {} failed: {}", attempt, maxAttempts, document.source(), ex.getMessage());
                if (!pause()) {
                    return IngestionResult.failed(document.id(), document.source(), ex.kind(), "Interrupted while retrying", attempt);
                }
            }
        }
    }

    private void index(SourceDocument document, List<TextChunk> chunks) {
        List<String> texts = chunks.stream().map(TextChunk::text).toList();
        EmbeddingsClient.EmbeddingBatch embeddings = embeddingsClient.embed(texts);
        if (embeddings.vectors().size() != chunks.size()) {
            throw new EmbeddingException("Embeddings response size did not match chunks");
        }
        List<IndexedPoint> points = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            TextChunk chunk = chunks.get(i);
            points.add(new IndexedPoint(chunk.id(), embeddings.vectors().get(i), payload(chunk)));
        }
        vectorStoreClient.ensureCollection(collection, embeddings.dimensions(), DistanceMetric.COSINE);
        vectorStoreClient.upsert(collection, points);
        chunkCounter.increment(points.size());
        try {
            vectorStoreClient.deleteDocumentChunksFrom(collection, document.id(), chunks.size());
        } catch (VectorStoreException ex) {
            log.warn("Could not remove stale chunks of document {}: {}", document.id(), ex.getMessage());
        }
    }

    private Map<String, Object> payload(TextChunk chunk) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PointPayload.TEXT, chunk.text());
        payload.put(PointPayload.SOURCE, chunk.source());
        payload.put(PointPayload.ORIGIN_TYPE, chunk.originType().payloadValue());
        payload.put(PointPayload.METADATA, chunk.metadata().asIndexPayload());
        payload.put(PointPayload.DOCUMENT_ID, chunk.documentId());
        payload.put(PointPayload.CHUNK_ID, chunk.id());
        payload.put(PointPayload.CHUNK_INDEX, chunk.index());
        return payload;
    }

    private void validateUpload(String filename, IngestDocumentCommand command) {
        String extension = "." + FilenameUtils.getExtension(filename).toLowerCase(Locale.ROOT);
        if (!DocumentTextExtractor.SUPPORTED_EXTENSIONS.contains(extension)) {
            throw new ValidationException("File type '" + extension + "' not supported. Use: "
                    + String.join(", ", DocumentTextExtractor.SUPPORTED_EXTENSIONS));
        }
        if (isEmpty(command)) {
            throw new ValidationException("Uploaded file is empty");
        }
    }

    private boolean isEmpty(IngestDocumentCommand command) {
        return command.bytes() == null || command.bytes().length == 0;
    }

    private boolean pause() {
        if (backoffMillis == 0) {
            return true;
        }
        try {
            Thread.sleep(backoffMillis);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private IngestionResult unexpectedFailure(String documentId, String source, Throwable ex) {
        log.error("Unexpected error while ingesting {}", source, ex);
        return IngestionResult.failed(documentId, source, ErrorKind.INTERNAL, "Unexpected error during ingestion", 0);
    }

    private IngestionResult record(IngestionResult result) {
        meterRegistry.counter("docchat.ingest.documents", "outcome", result.status().name().toLowerCase(Locale.ROOT)).increment();
        return result;
    }

    private static final class DocumentLock {

        private final ReentrantLock mutex = new ReentrantLock();
        private int users;
    }
}
