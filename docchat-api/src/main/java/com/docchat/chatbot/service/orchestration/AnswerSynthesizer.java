package com.docchat.chatbot.service.orchestration;

import com.docchat.chatbot.model.Answer;
import com.docchat.chatbot.model.RetrievedChunk;

import java.util.List;

public interface AnswerSynthesizer {

    /**
     * Grounded answer over the candidates. Degrades to {@link #fallback} instead of failing.
     */
    Answer synthesize(String query, List<RetrievedChunk> candidates);

    /**
     * Answer built from the candidates alone. Never throws.
     */
    Answer fallback(String query, List<RetrievedChunk> candidates);
}
