package com.docchat.chatbot.service.vectorstore;

import java.util.List;
import java.util.Map;

/**
 * Persisted unit of the index. The id is the chunk id, so writing the same chunk again replaces it.
 */
public record IndexedPoint(String id, List<Double> vector, Map<String, Object> payload) {
}
