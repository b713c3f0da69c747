package com.docchat.chatbot.service.vectorstore;

import com.docchat.chatbot.error.VectorStoreException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Component
@Profile("!inmemory")
public class QdrantVectorStoreClient implements VectorStoreClient {

    private static final Logger log = LoggerFactory.getLogger(QdrantVectorStoreClient.class);

    private final WebClient qdrantWebClient;
    private final Duration timeout;
    private final Set<String> ensuredCollections = ConcurrentHashMap.newKeySet();

    public QdrantVectorStoreClient(@Qualifier("qdrantWebClient") WebClient qdrantWebClient,
                                   @Value("${docchat.qdrant.timeout-seconds:30}") long timeoutSeconds) {
        this.qdrantWebClient = qdrantWebClient;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    @Override
    public void ensureCollection(String collection, int dimension, DistanceMetric metric) {
        if (ensuredCollections.contains(collection)) {
            return;
        }
        synchronized (this) {
            if (ensuredCollections.contains(collection)) {
                return;
            }
            CollectionResponse existing = fetchCollection(collection);
            if (existing == null) {
                createCollection(collection, dimension, metric);
            } else {
                verifySchema(collection, existing, dimension, metric);
                log.debug("Collection {} already exists", collection);
            }
            ensuredCollections.add(collection);
        }
    }

    @Override
    public void upsert(String collection, List<IndexedPoint> points) {
        if (points == null || points.isEmpty()) {
            return;
        }
        List<Point> body = points.stream()
                .map(point -> new Point(qdrantId(point.id()), point.vector(), point.payload()))
                .toList();
        try {
            qdrantWebClient.put()
                    .uri(uri -> uri.path("/collections/{collection}/points").queryParam("wait", true).build(collection))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new UpsertRequest(body))
                    .retrieve()
                    .bodyToMono(Void.class)
                    .timeout(timeout)
                    .onErrorResume(throwable -> {
                        log.error("Failed to upsert {} points into Qdrant collection {}: {}", body.size(), collection, throwable.getMessage());
                        return Mono.error(new VectorStoreException("Failed to upsert into Qdrant", throwable));
                    })
                    .block();
        } catch (VectorStoreException ex) {
            throw ex;
        } catch (Exception e) {
            throw new VectorStoreException("Failed to upsert into Qdrant", e);
        }
        log.info("Stored {} vectors in Qdrant collection {}", body.size(), collection);
    }

    @Override
    public List<ScoredPoint> search(String collection, List<Double> vector, int topK, double scoreThreshold) {
        SearchRequest request = new SearchRequest(vector, topK, scoreThreshold, true);
        SearchResponse response;
        try {
            response = qdrantWebClient.post()
                    .uri("/collections/{collection}/points/search", collection)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(SearchResponse.class)
                    .timeout(timeout)
                    .onErrorResume(WebClientResponseException.NotFound.class, notFound -> {
                        log.info("Collection {} does not exist yet, search returns nothing", collection);
                        return Mono.just(new SearchResponse(List.of()));
                    })
                    .onErrorResume(throwable -> !(throwable instanceof VectorStoreException), throwable -> {
                        log.error("Qdrant search failed: {}", throwable.getMessage());
                        return Mono.error(new VectorStoreException("Failed to search Qdrant", throwable));
                    })
                    .block();
        } catch (VectorStoreException ex) {
            throw ex;
        } catch (Exception e) {
            throw new VectorStoreException("Failed to search Qdrant", e);
        }
        if (response == null || response.result() == null) {
            return List.of();
        }
        List<ScoredPoint> hits = response.result().stream()
                .filter(hit -> hit.score() >= scoreThreshold)
                .map(Hit::toScoredPoint)
                .sorted(Comparator.comparingDouble(ScoredPoint::score).reversed())
                .limit(topK)
                .toList();
        log.info("Search returned {} results", hits.size());
        return hits;
    }

    @Override
    public void deleteDocumentChunksFrom(String collection, String documentId, int fromIndex) {
        Map<String, Object> filter = Map.of("must", List.of(
                Map.of("key", PointPayload.DOCUMENT_ID, "match", Map.of("value", documentId)),
                Map.of("key", PointPayload.CHUNK_INDEX, "range", Map.of("gte", fromIndex))
        ));
        try {
            qdrantWebClient.post()
                    .uri(uri -> uri.path("/collections/{collection}/points/delete").queryParam("wait", true).build(collection))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("filter", filter))
                    .retrieve()
                    .bodyToMono(Void.class)
                    .timeout(timeout)
                    .block();
        } catch (Exception e) {
            throw new VectorStoreException("Failed to delete stale chunks of document " + documentId, e);
        }
    }

    @Override
    public void deleteCollection(String collection) {
        try {
            qdrantWebClient.delete()
                    .uri("/collections/{collection}", collection)
                    .retrieve()
                    .bodyToMono(Void.class)
                    .timeout(timeout)
                    .onErrorResume(WebClientResponseException.NotFound.class, notFound -> Mono.empty())
                    .block();
        } catch (Exception e) {
            throw new VectorStoreException("Failed to delete Qdrant collection " + collection, e);
        } finally {
            ensuredCollections.remove(collection);
        }
        log.info("Collection {} deleted", collection);
    }

    @Override
    public CollectionInfo describe(String collection) {
        CollectionResponse response = fetchCollection(collection);
        if (response == null || response.result() == null) {
            log.warn("Collection {} does not exist yet", collection);
            return CollectionInfo.notCreated(collection);
        }
        CollectionResult result = response.result();
        long points = result.pointsCount() == null ? 0 : result.pointsCount();
        return new CollectionInfo(collection, result.status() == null ? "unknown" : result.status(), points);
    }

    private CollectionResponse fetchCollection(String collection) {
        try {
            return qdrantWebClient.get()
                    .uri("/collections/{collection}", collection)
                    .retrieve()
                    .bodyToMono(CollectionResponse.class)
                    .timeout(timeout)
                    .onErrorResume(WebClientResponseException.NotFound.class, notFound -> Mono.empty())
                    .block();
        } catch (Exception e) {
            log.error("Failed to read Qdrant collection {}", collection, e);
            throw new VectorStoreException("Failed to read Qdrant collection " + collection, e);
        }
    }

    private void createCollection(String collection, int dimension, DistanceMetric metric) {
        log.info("Creating collection {} (dimension {}, distance {})", collection, dimension, metric.qdrantName());
        try {
            qdrantWebClient.put()
                    .uri("/collections/{collection}", collection)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new CreateCollectionRequest(new VectorParams(dimension, metric.qdrantName())))
                    .retrieve()
                    .bodyToMono(Void.class)
                    .timeout(timeout)
                    .block();
        } catch (Exception e) {
            log.error("Error creating collection {}", collection, e);
            throw new VectorStoreException("Failed to create Qdrant collection " + collection, e);
        }
    }

    private void verifySchema(String collection, CollectionResponse existing, int dimension, DistanceMetric metric) {
        JsonNode vectors = existing.result() == null || existing.result().config() == null
                || existing.result().config().params() == null
                ? null
                : existing.result().config().params().vectors();
        if (vectors == null || !vectors.has("size")) {
            throw new VectorStoreException("Collection " + collection + " uses a vector layout this service cannot write to");
        }
        int size = vectors.path("size").asInt();
        if (size != dimension) {
            throw new VectorStoreException("Collection " + collection + " has dimension " + size
                    + " but embeddings have dimension " + dimension);
        }
        String distance = vectors.path("distance").asText("");
        if (!distance.isEmpty() && !distance.equalsIgnoreCase(metric.qdrantName())) {
            throw new VectorStoreException("Collection " + collection + " uses distance " + distance
                    + " instead of " + metric.qdrantName());
        }
    }

    /**
     * Qdrant accepts only unsigned integers and UUIDs as point ids.
     */
    static String qdrantId(String chunkId) {
        return UUID.nameUUIDFromBytes(chunkId.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private record Point(String id, List<Double> vector, Map<String, Object> payload) {}

    private record UpsertRequest(List<Point> points) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record SearchRequest(List<Double> vector,
                                 int limit,
                                 @JsonProperty("score_threshold") Double scoreThreshold,
                                 @JsonProperty("with_payload") boolean withPayload) {}

    private record SearchResponse(List<Hit> result) {}

    private record Hit(String id, double score, Map<String, Object> payload) {
        ScoredPoint toScoredPoint() {
            Map<String, Object> values = payload == null ? Collections.emptyMap() : payload;
            Object chunkId = values.get(PointPayload.CHUNK_ID);
            return new ScoredPoint(chunkId == null ? id : chunkId.toString(), score, values);
        }
    }

    private record CreateCollectionRequest(VectorParams vectors) {}

    private record VectorParams(int size, String distance) {}

    private record CollectionResponse(CollectionResult result, String status) {}

    private record CollectionResult(String status,
                                    @JsonProperty("points_count") Long pointsCount,
                                    CollectionConfig config) {}

    private record CollectionConfig(CollectionParams params) {}

    private record CollectionParams(JsonNode vectors) {}
}
