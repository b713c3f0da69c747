package com.docchat.chatbot.service.ingestion;

import com.docchat.chatbot.error.EmbeddingException;
import com.docchat.chatbot.error.ErrorKind;
import com.docchat.chatbot.error.ExtractionException;
import com.docchat.chatbot.error.ValidationException;
import com.docchat.chatbot.error.VectorStoreException;
import com.docchat.chatbot.service.embedding.EmbeddingsClient;
import com.docchat.chatbot.service.vectorstore.DistanceMetric;
import com.docchat.chatbot.service.vectorstore.IndexedPoint;
import com.docchat.chatbot.service.vectorstore.PointPayload;
import com.docchat.chatbot.service.vectorstore.VectorStoreClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultIngestionServiceTest {

    @Mock
    private DocumentTextExtractor textExtractor;

    @Mock
    private EmbeddingsClient embeddingsClient;

    @Mock
    private VectorStoreClient vectorStoreClient;

    private final TextChunker paragraphChunker = DefaultIngestionServiceTest::splitParagraphs;

    private SimpleMeterRegistry meterRegistry;
    private Scheduler scheduler;
    private DefaultIngestionService ingestionService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        scheduler = Schedulers.newBoundedElastic(4, 100, "ingest-test");
        ingestionService = service(1);
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    @Test
    void ingestEmbedsWholeDocumentAndUpsertsOnce() {
        when(embeddingsClient.embed(anyList())).thenAnswer(invocation -> batch(invocation.getArgument(0)));
        SourceDocument document = SourceDocument.of(OriginType.CMS, "handbook", "First part.\n\nSecond part.",
                DocumentMetadata.empty().withAttributes(Map.of("team", "ops")));

        IngestionResult result = ingestionService.ingest(document);

        assertThat(result.status()).isEqualTo(IngestionResult.Status.INDEXED);
        assertThat(result.chunks()).isEqualTo(2);
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.documentId()).isEqualTo(document.id());

        verify(embeddingsClient).embed(List.of("First part.", "Second part."));
        verify(vectorStoreClient).ensureCollection("documents", 2, DistanceMetric.COSINE);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<IndexedPoint>> captor = ArgumentCaptor.forClass((Class) List.class);
        verify(vectorStoreClient).upsert(eq("documents"), captor.capture());
        List<IndexedPoint> points = captor.getValue();
        assertThat(points).extracting(IndexedPoint::id).containsExactly(document.id() + "-0", document.id() + "-1");
        assertThat(points.get(1).payload())
                .containsEntry(PointPayload.TEXT, "Second part.")
                .containsEntry(PointPayload.SOURCE, "handbook")
                .containsEntry(PointPayload.ORIGIN_TYPE, "cms")
                .containsEntry(PointPayload.DOCUMENT_ID, document.id())
                .containsEntry(PointPayload.CHUNK_INDEX, 1)
                .containsEntry(PointPayload.METADATA, Map.of("team", "ops"));
        verify(vectorStoreClient).deleteDocumentChunksFrom("documents", document.id(), 2);

        assertThat(meterRegistry.counter("docchat.ingest.documents", "outcome", "indexed").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("docchat.ingest.chunks").count()).isEqualTo(2.0);
    }

    @Test
    void whitespaceDocumentIsEmptyAndTouchesNothing() {
        IngestionResult result = ingestionService.ingest(SourceDocument.of(OriginType.FILE, "blank.txt", "  \n ", null));

        assertThat(result.status()).isEqualTo(IngestionResult.Status.EMPTY);
        assertThat(result.chunks()).isZero();
        verifyNoInteractions(embeddingsClient, vectorStoreClient);
    }

    @Test
    void embeddingFailureMarksDocumentFailedWithoutUpsert() {
        when(embeddingsClient.embed(anyList())).thenThrow(new EmbeddingException("embedder down"));

        IngestionResult result = ingestionService.ingest(SourceDocument.of(OriginType.FILE, "a.txt", "Some text.", null));

        assertThat(result.status()).isEqualTo(IngestionResult.Status.FAILED);
        assertThat(result.errorKind()).isEqualTo(ErrorKind.EMBEDDING);
        assertThat(result.detail()).isEqualTo("embedder down");
        verifyNoInteractions(vectorStoreClient);
        assertThat(ingestionService.trackedDocumentLocks()).isZero();
    }

    @Test
    void transientFailuresAreRetriedUpToConfiguredAttempts() {
        ingestionService = service(3);
        when(embeddingsClient.embed(anyList())).thenAnswer(invocation -> batch(invocation.getArgument(0)));
        doThrow(new VectorStoreException("timeout")).doNothing().when(vectorStoreClient).upsert(anyString(), anyList());

        IngestionResult result = ingestionService.ingest(SourceDocument.of(OriginType.FILE, "a.txt", "Some text.", null));

        assertThat(result.status()).isEqualTo(IngestionResult.Status.INDEXED);
        assertThat(result.attempts()).isEqualTo(2);
        verify(vectorStoreClient, times(2)).upsert(anyString(), anyList());
    }

    @Test
    void defaultPolicyDoesNotRetry() {
        when(embeddingsClient.embed(anyList())).thenAnswer(invocation -> batch(invocation.getArgument(0)));
        doThrow(new VectorStoreException("timeout")).when(vectorStoreClient).upsert(anyString(), anyList());

        IngestionResult result = ingestionService.ingest(SourceDocument.of(OriginType.FILE, "a.txt", "Some text.", null));

        assertThat(result.status()).isEqualTo(IngestionResult.Status.FAILED);
        assertThat(result.errorKind()).isEqualTo(ErrorKind.STORE);
        assertThat(result.attempts()).isEqualTo(1);
    }

    @Test
    void validationFailuresAreNeverRetried() {
        ingestionService = service(3);
        when(embeddingsClient.embed(anyList())).thenThrow(new ValidationException("bad input"));

        IngestionResult result = ingestionService.ingest(SourceDocument.of(OriginType.FILE, "a.txt", "Some text.", null));

        assertThat(result.errorKind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(result.attempts()).isEqualTo(1);
        verify(embeddingsClient, times(1)).embed(anyList());
    }

    @Test
    void staleChunkCleanupFailureDoesNotFailIngestion() {
        when(embeddingsClient.embed(anyList())).thenAnswer(invocation -> batch(invocation.getArgument(0)));
        doThrow(new VectorStoreException("delete failed"))
                .when(vectorStoreClient).deleteDocumentChunksFrom(anyString(), anyString(), anyInt());

        IngestionResult result = ingestionService.ingest(SourceDocument.of(OriginType.FILE, "a.txt", "Some text.", null));

        assertThat(result.status()).isEqualTo(IngestionResult.Status.INDEXED);
    }

    @Test
    void ingestAllKeepsInputOrderAndIsolatesFailures() {
        when(embeddingsClient.embed(anyList())).thenAnswer(invocation -> {
            List<String> texts = invocation.getArgument(0);
            if (texts.contains("Broken.")) {
                throw new EmbeddingException("cannot embed");
            }
            return batch(texts);
        });
        List<SourceDocument> documents = List.of(
                SourceDocument.of(OriginType.FILE, "one.txt", "One.", null),
                SourceDocument.of(OriginType.FILE, "two.txt", "Broken.", null),
                SourceDocument.of(OriginType.FILE, "three.txt", "Three.\n\nThree again.", null));

        StepVerifier.create(ingestionService.ingestAll(documents))
                .assertNext(summary -> {
                    assertThat(summary.results()).extracting(IngestionResult::source)
                            .containsExactly("one.txt", "two.txt", "three.txt");
                    assertThat(summary.results()).extracting(IngestionResult::status).containsExactly(
                            IngestionResult.Status.INDEXED, IngestionResult.Status.FAILED, IngestionResult.Status.INDEXED);
                    assertThat(summary.documents()).isEqualTo(3);
                    assertThat(summary.indexed()).isEqualTo(2);
                    assertThat(summary.failed()).isEqualTo(1);
                    assertThat(summary.chunks()).isEqualTo(3);
                })
                .verifyComplete();
    }

    @Test
    void documentLocksAreReleasedAfterIngestion() {
        when(embeddingsClient.embed(anyList())).thenAnswer(invocation -> batch(invocation.getArgument(0)));
        List<SourceDocument> documents = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            documents.add(SourceDocument.of(OriginType.FILE, "doc-" + (i % 3) + ".txt", "Text " + i + ".", null));
        }

        StepVerifier.create(ingestionService.ingestAll(documents))
                .assertNext(summary -> assertThat(summary.indexed()).isEqualTo(12))
                .verifyComplete();

        assertThat(ingestionService.trackedDocumentLocks()).isZero();
    }

    @Test
    void ingestAllRejectsEmptyBatch() {
        StepVerifier.create(ingestionService.ingestAll(List.of()))
                .expectError(ValidationException.class)
                .verify();
    }

    @Test
    void ingestDocumentsExtractsEachFileAndReportsRejectedOnes() {
        when(textExtractor.extract(anyString(), any())).thenAnswer(invocation -> {
            if ("broken.docx".equals(invocation.getArgument(0))) {
                throw new ExtractionException("corrupt");
            }
            return new DocumentTextExtractor.ExtractedDocument(
                    DocumentMetadata.empty().withContentType("application/pdf"), "Quarterly numbers.");
        });
        when(embeddingsClient.embed(anyList())).thenAnswer(invocation -> batch(invocation.getArgument(0)));

        List<IngestDocumentCommand> commands = List.of(
                command("report.pdf", "pdf bytes"),
                command("image.png", "png bytes"),
                command("broken.docx", "docx bytes"));

        StepVerifier.create(ingestionService.ingestDocuments(commands))
                .assertNext(summary -> {
                    assertThat(summary.results()).extracting(IngestionResult::status).containsExactly(
                            IngestionResult.Status.INDEXED, IngestionResult.Status.FAILED, IngestionResult.Status.FAILED);
                    assertThat(summary.results()).extracting(IngestionResult::errorKind)
                            .containsExactly(null, ErrorKind.VALIDATION, ErrorKind.EXTRACTION);
                    assertThat(summary.results().get(0).documentId())
                            .isEqualTo(DocumentIds.forSource(OriginType.FILE, "report.pdf"));
                })
                .verifyComplete();
        verify(textExtractor, never()).extract(eq("image.png"), any());
    }

    @Test
    void singleEmptyUploadIsAValidationError() {
        StepVerifier.create(ingestionService.ingestDocuments(List.of(new IngestDocumentCommand("a.txt", "text/plain", new byte[0]))))
                .expectError(ValidationException.class)
                .verify();
        verifyNoInteractions(textExtractor);
    }

    @Test
    void ingestTextDefaultsSourceAndKeepsMetadata() {
        when(embeddingsClient.embed(anyList())).thenAnswer(invocation -> batch(invocation.getArgument(0)));

        IngestionResult result = ingestionService.ingestText(new IngestTextCommand(null, "CMS page body.", Map.of("page", 7)));

        assertThat(result.source()).isEqualTo("cms");
        assertThat(result.documentId()).isEqualTo(DocumentIds.forSource(OriginType.CMS, "cms"));
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<IndexedPoint>> captor = ArgumentCaptor.forClass((Class) List.class);
        verify(vectorStoreClient).upsert(eq("documents"), captor.capture());
        @SuppressWarnings("unchecked")
        Map<String, Object> metadata = (Map<String, Object>) captor.getValue().get(0).payload().get(PointPayload.METADATA);
        assertThat(metadata).containsEntry("page", 7).containsKey("timestamp");
    }

    @Test
    void ingestTextRejectsBlankContent() {
        assertThatThrownBy(() -> ingestionService.ingestText(new IngestTextCommand("cms", " ", Map.of())))
                .isInstanceOf(ValidationException.class);
    }

    private DefaultIngestionService service(int maxAttempts) {
        return new DefaultIngestionService(textExtractor, paragraphChunker, embeddingsClient, vectorStoreClient,
                scheduler, meterRegistry, "documents", 4, maxAttempts, 0);
    }

    private static IngestDocumentCommand command(String filename, String content) {
        return new IngestDocumentCommand(filename, null, content.getBytes(StandardCharsets.UTF_8));
    }

    private static EmbeddingsClient.EmbeddingBatch batch(List<String> texts) {
        List<List<Double>> vectors = new ArrayList<>();
        for (int i = 0; i < texts.size(); i++) {
            vectors.add(List.of(1.0, 0.0));
        }
        return new EmbeddingsClient.EmbeddingBatch(vectors, "test-model", 2);
    }

    private static List<TextChunk> splitParagraphs(SourceDocument document) {
        List<TextChunk> chunks = new ArrayList<>();
        int offset = 0;
        for (String part : document.text().split("\n\n")) {
            int start = document.text().indexOf(part, offset);
            offset = start + part.length();
            if (part.isBlank()) {
                continue;
            }
            chunks.add(new TextChunk(DocumentIds.chunkId(document.id(), chunks.size()), document.id(), chunks.size(), part,
                    start, offset, document.source(), document.originType(), document.metadata()));
        }
        return chunks;
    }
}
