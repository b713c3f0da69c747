package com.docchat.chatbot.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

public record ChatResponse(String answer, List<SourceView> sources) {

    public static ChatResponse from(Answer answer) {
        List<SourceView> sources = answer.citations().stream()
                .map(SourceView::from)
                .toList();
        return new ChatResponse(answer.text(), sources);
    }

    public record SourceView(String text, String source, double score) {

        static SourceView from(Citation citation) {
            double rounded = BigDecimal.valueOf(citation.score()).setScale(3, RoundingMode.HALF_UP).doubleValue();
            return new SourceView(citation.text(), citation.source(), rounded);
        }
    }
}
