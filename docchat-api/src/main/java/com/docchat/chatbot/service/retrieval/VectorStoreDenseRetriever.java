package com.docchat.chatbot.service.retrieval;

import com.docchat.chatbot.error.ValidationException;
import com.docchat.chatbot.model.RetrievedChunk;
import com.docchat.chatbot.service.vectorstore.PointPayload;
import com.docchat.chatbot.service.vectorstore.ScoredPoint;
import com.docchat.chatbot.service.vectorstore.VectorStoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;

@Component
public class VectorStoreDenseRetriever implements DenseRetriever {

    private static final Logger log = LoggerFactory.getLogger(VectorStoreDenseRetriever.class);

    private final VectorStoreClient vectorStoreClient;
    private final String collection;
    private final int topK;
    private final double scoreThreshold;

    public VectorStoreDenseRetriever(VectorStoreClient vectorStoreClient,
                                     @Value("${docchat.qdrant.collection:documents}") String collection,
                                     @Value("${docchat.retrieval.top-k:5}") int topK,
                                     @Value("${docchat.retrieval.score-threshold:0.3}") double scoreThreshold) {
        if (topK <= 0) {
            throw new IllegalArgumentException("docchat.retrieval.top-k must be positive");
        }
        this.vectorStoreClient = vectorStoreClient;
        this.collection = collection;
        this.topK = topK;
        this.scoreThreshold = scoreThreshold;
    }

    @Override
    public List<RetrievedChunk> retrieve(List<Double> queryVector) {
        return retrieve(queryVector, topK, scoreThreshold);
    }

    @Override
    public List<RetrievedChunk> retrieve(List<Double> queryVector, int topK, double scoreThreshold) {
        if (queryVector == null || queryVector.isEmpty()) {
            throw new ValidationException("Query vector is empty");
        }
        if (topK <= 0) {
            throw new ValidationException("topK must be positive");
        }
        List<ScoredPoint> hits = vectorStoreClient.search(collection, queryVector, topK, scoreThreshold);
        if (hits.isEmpty()) {
            log.info("No chunks scored above {} in collection {}", scoreThreshold, collection);
            return List.of();
        }
        return hits.stream().map(VectorStoreDenseRetriever::toChunk).toList();
    }

    public int topK() {
        return topK;
    }

    public double scoreThreshold() {
        return scoreThreshold;
    }

    @SuppressWarnings("unchecked")
    private static RetrievedChunk toChunk(ScoredPoint point) {
        Map<String, Object> payload = point.payload() == null ? Collections.emptyMap() : point.payload();
        Object metadata = payload.get(PointPayload.METADATA);
        return new RetrievedChunk(
                point.id(),
                asString(payload.get(PointPayload.DOCUMENT_ID)),
                asString(payload.get(PointPayload.TEXT)),
                asString(payload.get(PointPayload.SOURCE)),
                point.score(),
                metadata instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of()
        );
    }

    private static String asString(Object value) {
        return value == null ? "" : value.toString();
    }
}
