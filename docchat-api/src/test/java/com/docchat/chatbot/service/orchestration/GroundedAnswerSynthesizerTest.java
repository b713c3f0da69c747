package com.docchat.chatbot.service.orchestration;

import com.docchat.chatbot.error.SynthesisException;
import com.docchat.chatbot.model.Answer;
import com.docchat.chatbot.model.Citation;
import com.docchat.chatbot.model.RetrievedChunk;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GroundedAnswerSynthesizerTest {

    private final LlmClient llmClient = mock(LlmClient.class);

    @Test
    void withoutLlmOneCandidateYieldsFallbackTemplate() {
        GroundedAnswerSynthesizer synthesizer = new GroundedAnswerSynthesizer((LlmClient) null, 3, 2048, 0.4);
        RetrievedChunk chunk = chunk("c-0", "Paris is the capital of France.", 0.82);

        Answer answer = synthesizer.synthesize("What is the capital of France?", List.of(chunk));

        assertThat(answer.text()).isEqualTo("Based on the available information: Paris is the capital of France.");
        assertThat(answer.citations()).containsExactly(new Citation("c-0", "Paris is the capital of France.", "facts.txt", 0.82));
        assertThat(answer.fallback()).isTrue();
    }

    @Test
    void noCandidatesYieldsNoInformationMessage() {
        GroundedAnswerSynthesizer synthesizer = new GroundedAnswerSynthesizer(llmClient, 3, 2048, 0.4);

        Answer answer = synthesizer.synthesize("Anything?", List.of());

        assertThat(answer.text()).isEqualTo("I couldn't find any relevant information in the documents. "
                + "Please try a different question or upload more relevant documents.");
        assertThat(answer.citations()).isEmpty();
        assertThat(answer.fallback()).isTrue();
    }

    @Test
    void fallbackQuotesHighestScoringChunk() {
        GroundedAnswerSynthesizer synthesizer = new GroundedAnswerSynthesizer((LlmClient) null, 3, 2048, 0.4);

        Answer answer = synthesizer.fallback("q", List.of(chunk("low", "Low.", 0.4), chunk("high", "High.", 0.9)));

        assertThat(answer.text()).isEqualTo("Based on the available information: High.");
        assertThat(answer.citations()).extracting(Citation::chunkId).containsExactly("high");
    }

    @Test
    void generatedAnswerIsCleanedAndCitesItsContext() {
        when(llmClient.generate(any())).thenReturn("- the capital of France is Paris");
        GroundedAnswerSynthesizer synthesizer = new GroundedAnswerSynthesizer(llmClient, 3, 2048, 0.4);
        List<RetrievedChunk> candidates = List.of(
                chunk("b", "France is in Europe.", 0.55),
                chunk("a", "Paris is the capital of France.", 0.91));

        Answer answer = synthesizer.synthesize("What is the capital of France?", candidates);

        assertThat(answer.text()).isEqualTo("The capital of France is Paris.");
        assertThat(answer.fallback()).isFalse();
        assertThat(answer.citations()).extracting(Citation::chunkId).containsExactly("a", "b");

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmClient).generate(captor.capture());
        assertThat(captor.getValue().question()).isEqualTo("What is the capital of France?");
        assertThat(captor.getValue().context()).extracting(RetrievedChunk::chunkId).containsExactly("a", "b");
    }

    @Test
    void generationFailureDegradesToFallback() {
        when(llmClient.generate(any())).thenThrow(new SynthesisException("model offline"));
        GroundedAnswerSynthesizer synthesizer = new GroundedAnswerSynthesizer(llmClient, 3, 2048, 0.4);

        Answer answer = synthesizer.synthesize("q", List.of(chunk("a", "Some fact.", 0.7)));

        assertThat(answer.fallback()).isTrue();
        assertThat(answer.text()).isEqualTo("Based on the available information: Some fact.");
    }

    @Test
    void blankGenerationDegradesToFallback() {
        when(llmClient.generate(any())).thenReturn("   ");
        GroundedAnswerSynthesizer synthesizer = new GroundedAnswerSynthesizer(llmClient, 3, 2048, 0.4);

        Answer answer = synthesizer.synthesize("q", List.of(chunk("a", "Some fact.", 0.7)));

        assertThat(answer.fallback()).isTrue();
    }

    @Test
    void contextPrefersStrongMatchesCappedAtMaximum() {
        GroundedAnswerSynthesizer synthesizer = new GroundedAnswerSynthesizer(llmClient, 3, 2048, 0.4);

        List<RetrievedChunk> context = synthesizer.selectContext(List.of(
                chunk("d", "d", 0.6),
                chunk("a", "a", 0.9),
                chunk("e", "e", 0.35),
                chunk("b", "b", 0.8),
                chunk("c", "c", 0.7)));

        assertThat(context).extracting(RetrievedChunk::chunkId).containsExactly("a", "b", "c");
    }

    @Test
    void contextFallsBackToTopTwoWhenAllMatchesAreWeak() {
        GroundedAnswerSynthesizer synthesizer = new GroundedAnswerSynthesizer(llmClient, 3, 2048, 0.4);

        List<RetrievedChunk> context = synthesizer.selectContext(List.of(
                chunk("c", "c", 0.31),
                chunk("a", "a", 0.38),
                chunk("b", "b", 0.35)));

        assertThat(context).extracting(RetrievedChunk::chunkId).containsExactly("a", "b");
    }

    @Test
    void postProcessStripsListMarkersAndTerminatesSentence() {
        assertThat(GroundedAnswerSynthesizer.postProcess("ii. paris")).isEqualTo("Paris.");
        assertThat(GroundedAnswerSynthesizer.postProcess("* It is Paris!")).isEqualTo("It is Paris!");
        assertThat(GroundedAnswerSynthesizer.postProcess("  Paris  ")).isEqualTo("Paris.");
        assertThat(GroundedAnswerSynthesizer.postProcess("Is it Paris?")).isEqualTo("Is it Paris?");
        assertThat(GroundedAnswerSynthesizer.postProcess(null)).isEmpty();
    }

    private static RetrievedChunk chunk(String id, String text, double score) {
        return new RetrievedChunk(id, "doc", text, "facts.txt", score, Map.of());
    }
}
