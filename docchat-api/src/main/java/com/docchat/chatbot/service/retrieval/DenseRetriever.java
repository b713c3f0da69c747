package com.docchat.chatbot.service.retrieval;

import com.docchat.chatbot.model.RetrievedChunk;

import java.util.List;

public interface DenseRetriever {

    /**
     * Nearest chunks for an embedded query using the configured top-k and score threshold.
     */
    List<RetrievedChunk> retrieve(List<Double> queryVector);

    List<RetrievedChunk> retrieve(List<Double> queryVector, int topK, double scoreThreshold);
}
