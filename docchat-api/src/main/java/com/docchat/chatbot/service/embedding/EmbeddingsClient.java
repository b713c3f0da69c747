package com.docchat.chatbot.service.embedding;

import java.util.List;

/**
 * Maps text to unit-length vectors. One instance, and therefore one model, serves both ingestion and queries.
 */
public interface EmbeddingsClient {

    /**
     * Embeds every text in order. Either the whole batch is returned or an
     * {@link com.docchat.chatbot.error.EmbeddingException} is thrown.
     */
    EmbeddingBatch embed(List<String> texts);

    default List<Double> embedOne(String text) {
        return embed(List.of(text)).vectors().get(0);
    }

    String model();

    int dimensions();

    record EmbeddingBatch(List<List<Double>> vectors, String model, int dimensions) {}
}
