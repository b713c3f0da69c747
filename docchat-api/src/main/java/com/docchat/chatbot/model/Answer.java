package com.docchat.chatbot.model;

import java.util.List;

/**
 * Reply to a query. {@code fallback} is set when the text was assembled from the retrieved chunks
 * instead of being generated.
 */
public record Answer(String text, List<Citation> citations, boolean fallback) {

    public Answer {
        citations = citations == null ? List.of() : List.copyOf(citations);
    }
}
