package com.docchat.chatbot.controller;

import com.docchat.chatbot.model.CmsImportRequest;
import com.docchat.chatbot.model.CmsImportResponse;
import com.docchat.chatbot.model.StatusResponse;
import com.docchat.chatbot.model.UploadResponse;
import com.docchat.chatbot.service.ingestion.IngestDocumentCommand;
import com.docchat.chatbot.service.ingestion.IngestTextCommand;
import com.docchat.chatbot.service.ingestion.IngestionResult;
import com.docchat.chatbot.service.ingestion.IngestionService;
import com.docchat.chatbot.service.vectorstore.CollectionInfo;
import com.docchat.chatbot.service.vectorstore.VectorStoreClient;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
public class IngestionController {

    private final IngestionService ingestionService;
    private final VectorStoreClient vectorStoreClient;
    private final String collection;

    public IngestionController(IngestionService ingestionService,
                               VectorStoreClient vectorStoreClient,
                               @Value("${docchat.qdrant.collection:documents}") String collection) {
        this.ingestionService = ingestionService;
        this.vectorStoreClient = vectorStoreClient;
        this.collection = collection;
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<UploadResponse> upload(@RequestPart(value = "file", required = false) Flux<FilePart> files) {
        Flux<FilePart> parts = files == null ? Flux.empty() : files;
        return parts.concatMap(this::toCommand)
                .collectList()
                .flatMap(ingestionService::ingestDocuments)
                .map(UploadResponse::from);
    }

    @PostMapping(value = "/import-cms", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<CmsImportResponse> importCms(@Valid @RequestBody CmsImportRequest request) {
        return Mono.fromCallable(() -> ingestionService.ingestText(
                        new IngestTextCommand(request.source(), request.content(), request.metadata())))
                .subscribeOn(Schedulers.boundedElastic())
                .map(IngestionResult::orThrow)
                .map(result -> new CmsImportResponse(
                        "success",
                        result.source(),
                        result.chunks(),
                        result.status() == IngestionResult.Status.EMPTY
                                ? "CMS content produced no chunks"
                                : "CMS content imported successfully"));
    }

    @DeleteMapping(value = "/clear", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<StatusResponse> clear() {
        return Mono.fromRunnable(() -> vectorStoreClient.deleteCollection(collection))
                .subscribeOn(Schedulers.boundedElastic())
                .thenReturn(new StatusResponse("success", "Database cleared"));
    }

    @GetMapping(value = "/collection", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<CollectionInfo> collection() {
        return Mono.fromCallable(() -> vectorStoreClient.describe(collection))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<IngestDocumentCommand> toCommand(FilePart part) {
        String contentType = part.headers().getContentType() == null ? null : part.headers().getContentType().toString();
        return DataBufferUtils.join(part.content())
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .defaultIfEmpty(new byte[0])
                .map(bytes -> new IngestDocumentCommand(part.filename(), contentType, bytes));
    }
}
