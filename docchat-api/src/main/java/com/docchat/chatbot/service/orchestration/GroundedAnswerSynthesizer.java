package com.docchat.chatbot.service.orchestration;

import com.docchat.chatbot.model.Answer;
import com.docchat.chatbot.model.Citation;
import com.docchat.chatbot.model.RetrievedChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Answers from retrieved chunks only. Uses the LLM when one is configured and falls back to quoting
 * the best chunk whenever generation is unavailable or fails.
 */
@Service
public class GroundedAnswerSynthesizer implements AnswerSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(GroundedAnswerSynthesizer.class);

    static final String SYSTEM_PROMPT = "Based on the following document excerpts, answer the user's question. "
            + "If the answer cannot be found in the excerpts, say \"I don't have enough information to answer "
            + "that question based on the provided documents.\"";
    static final String NO_INFORMATION = "I couldn't find any relevant information in the documents. "
            + "Please try a different question or upload more relevant documents.";
    static final String FALLBACK_PREFIX = "Based on the available information: ";

    private static final List<String> LIST_PREFIXES = List.of("i. ", "ii. ", "iii. ", "iv. ", "v. ", "- ", "* ");
    private static final int MIN_CONTEXT_CHUNKS = 2;

    private final LlmClient llmClient;
    private final TokenBudgetGuard tokenGuard;
    private final int maxContextChunks;
    private final double preferredScore;

    @Autowired
    public GroundedAnswerSynthesizer(ObjectProvider<LlmClient> llmClient,
                                     @Value("${docchat.answer.max-context-chunks:3}") int maxContextChunks,
                                     @Value("${docchat.answer.max-context-tokens:2048}") int maxContextTokens,
                                     @Value("${docchat.answer.preferred-score:0.4}") double preferredScore) {
        this(llmClient.getIfAvailable(), maxContextChunks, maxContextTokens, preferredScore);
    }

    public GroundedAnswerSynthesizer(LlmClient llmClient, int maxContextChunks, int maxContextTokens, double preferredScore) {
        this.llmClient = llmClient;
        this.tokenGuard = new TokenBudgetGuard(maxContextTokens);
        this.maxContextChunks = Math.max(1, maxContextChunks);
        this.preferredScore = preferredScore;
        if (llmClient == null) {
            log.info("No LLM configured, answers are assembled from retrieved chunks");
        }
    }

    @Override
    public Answer synthesize(String query, List<RetrievedChunk> candidates) {
        if (candidates == null || candidates.isEmpty() || llmClient == null) {
            return fallback(query, candidates);
        }
        List<RetrievedChunk> context = selectContext(candidates);
        try {
            String generated = llmClient.generate(new LlmRequest(SYSTEM_PROMPT, query, context));
            String answer = postProcess(generated);
            if (answer.isEmpty()) {
                log.warn("LLM produced a blank answer, using fallback");
                return fallback(query, candidates);
            }
            List<Citation> citations = context.stream().map(Citation::of).toList();
            return new Answer(answer, citations, false);
        } catch (RuntimeException ex) {
            log.warn("Answer generation failed, using fallback: {}", ex.getMessage());
            return fallback(query, candidates);
        }
    }

    @Override
    public Answer fallback(String query, List<RetrievedChunk> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return new Answer(NO_INFORMATION, List.of(), true);
        }
        RetrievedChunk top = sortByScore(candidates).get(0);
        return new Answer(FALLBACK_PREFIX + top.text(), List.of(Citation.of(top)), true);
    }

    List<RetrievedChunk> selectContext(List<RetrievedChunk> candidates) {
        List<RetrievedChunk> sorted = sortByScore(candidates);
        List<RetrievedChunk> preferred = sorted.stream()
                .filter(chunk -> chunk.score() > preferredScore)
                .toList();
        if (preferred.isEmpty()) {
            preferred = sorted.subList(0, Math.min(MIN_CONTEXT_CHUNKS, sorted.size()));
        }
        List<RetrievedChunk> capped = preferred.subList(0, Math.min(maxContextChunks, preferred.size()));
        TokenBudgetGuard.GuardedChunks guarded = tokenGuard.enforce(capped);
        if (guarded.truncated()) {
            log.debug("Context truncated to {} of {} chunks by token budget", guarded.chunks().size(), capped.size());
        }
        return guarded.chunks();
    }

    static String postProcess(String generated) {
        if (generated == null) {
            return "";
        }
        String answer = generated.strip();
        for (String prefix : LIST_PREFIXES) {
            if (answer.toLowerCase(Locale.ROOT).startsWith(prefix)) {
                answer = capitalize(answer.substring(prefix.length()).strip());
            }
        }
        if (!answer.isEmpty()) {
            char last = answer.charAt(answer.length() - 1);
            if (last != '.' && last != '!' && last != '?') {
                answer = answer + '.';
            }
        }
        return answer;
    }

    private static String capitalize(String text) {
        if (text.isEmpty()) {
            return text;
        }
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    private static List<RetrievedChunk> sortByScore(List<RetrievedChunk> candidates) {
        return candidates.stream()
                .sorted(Comparator.comparingDouble(RetrievedChunk::score).reversed())
                .toList();
    }
}
