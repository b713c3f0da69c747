package com.docchat.chatbot.service.vectorstore;

import java.util.List;

public interface VectorStoreClient {

    /**
     * Creates the collection when it is missing. Fails with
     * {@link com.docchat.chatbot.error.VectorStoreException} when it exists with another dimension or metric.
     */
    void ensureCollection(String collection, int dimension, DistanceMetric metric);

    /**
     * Writes the whole batch in one call; the points are searchable once this returns.
     */
    void upsert(String collection, List<IndexedPoint> points);

    /**
     * Up to {@code topK} points by descending score, none below {@code scoreThreshold}.
     * A missing collection is an empty result.
     */
    List<ScoredPoint> search(String collection, List<Double> vector, int topK, double scoreThreshold);

    /**
     * Removes chunks of a document whose index is {@code fromIndex} or higher.
     */
    void deleteDocumentChunksFrom(String collection, String documentId, int fromIndex);

    void deleteCollection(String collection);

    CollectionInfo describe(String collection);
}
