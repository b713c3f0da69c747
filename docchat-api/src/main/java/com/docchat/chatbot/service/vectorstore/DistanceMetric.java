package com.docchat.chatbot.service.vectorstore;

public enum DistanceMetric {
    COSINE("Cosine"),
    DOT("Dot"),
    EUCLID("Euclid");

    private final String qdrantName;

    DistanceMetric(String qdrantName) {
        this.qdrantName = qdrantName;
    }

    public String qdrantName() {
        return qdrantName;
    }
}
