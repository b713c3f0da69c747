package com.docchat.chatbot.service.vectorstore;

import com.docchat.chatbot.error.VectorStoreException;
import com.docchat.chatbot.service.embedding.VectorMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store for development runs without Qdrant. Points live in insertion order per collection,
 * which is also the tie-break order of {@link #search}.
 */
@Component
@Profile("inmemory")
public class InMemoryVectorStoreClient implements VectorStoreClient {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorStoreClient.class);

    private final Map<String, Collection> collections = new ConcurrentHashMap<>();

    @Override
    public void ensureCollection(String collection, int dimension, DistanceMetric metric) {
        if (metric != DistanceMetric.COSINE) {
            throw new VectorStoreException("In-memory store only supports cosine distance");
        }
        Collection existing = collections.computeIfAbsent(collection, name -> {
            log.info("Creating in-memory collection {} (dimension {})", name, dimension);
            return new Collection(dimension);
        });
        if (existing.dimension != dimension) {
            throw new VectorStoreException("Collection " + collection + " has dimension " + existing.dimension
                    + " but embeddings have dimension " + dimension);
        }
    }

    @Override
    public void upsert(String collection, List<IndexedPoint> points) {
        if (points == null || points.isEmpty()) {
            return;
        }
        Collection target = require(collection);
        for (IndexedPoint point : points) {
            if (point.vector() == null || point.vector().size() != target.dimension) {
                throw new VectorStoreException("Point " + point.id() + " does not match collection dimension " + target.dimension);
            }
        }
        synchronized (target) {
            for (IndexedPoint point : points) {
                target.points.put(point.id(), point);
            }
        }
        log.info("Stored {} vectors in in-memory collection {}", points.size(), collection);
    }

    @Override
    public List<ScoredPoint> search(String collection, List<Double> vector, int topK, double scoreThreshold) {
        Collection target = collections.get(collection);
        if (target == null) {
            return List.of();
        }
        List<IndexedPoint> snapshot;
        synchronized (target) {
            snapshot = new ArrayList<>(target.points.values());
        }
        List<ScoredPoint> scored = new ArrayList<>();
        for (IndexedPoint point : snapshot) {
            double score = VectorMath.cosine(vector, point.vector());
            if (score >= scoreThreshold) {
                scored.add(new ScoredPoint(point.id(), score, point.payload()));
            }
        }
        // List.sort is stable, so equal scores keep insertion order
        scored.sort(Comparator.comparingDouble(ScoredPoint::score).reversed());
        return List.copyOf(scored.subList(0, Math.min(topK, scored.size())));
    }

    @Override
    public void deleteDocumentChunksFrom(String collection, String documentId, int fromIndex) {
        Collection target = collections.get(collection);
        if (target == null) {
            return;
        }
        synchronized (target) {
            target.points.values().removeIf(point -> documentId.equals(point.payload().get(PointPayload.DOCUMENT_ID))
                    && point.payload().get(PointPayload.CHUNK_INDEX) instanceof Number index
                    && index.intValue() >= fromIndex);
        }
    }

    @Override
    public void deleteCollection(String collection) {
        collections.remove(collection);
        log.info("Collection {} deleted", collection);
    }

    @Override
    public CollectionInfo describe(String collection) {
        Collection target = collections.get(collection);
        if (target == null) {
            return CollectionInfo.notCreated(collection);
        }
        synchronized (target) {
            return new CollectionInfo(collection, "green", target.points.size());
        }
    }

    private Collection require(String collection) {
        Collection target = collections.get(collection);
        if (target == null) {
            throw new VectorStoreException("Collection " + collection + " does not exist");
        }
        return target;
    }

    private static final class Collection {
        private final int dimension;
        private final Map<String, IndexedPoint> points = new LinkedHashMap<>();

        private Collection(int dimension) {
            this.dimension = dimension;
        }
    }
}
