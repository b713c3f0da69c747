package com.docchat.chatbot.service.embedding;

import com.docchat.chatbot.error.EmbeddingException;
import com.docchat.chatbot.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
public class WebClientEmbeddingsClient implements EmbeddingsClient {

    private static final Logger log = LoggerFactory.getLogger(WebClientEmbeddingsClient.class);

    private final WebClient embeddingsWebClient;
    private final String model;
    private final int dimensions;
    private final Duration timeout;
    private final int maxInputChars;

    public WebClientEmbeddingsClient(@Qualifier("embeddingsWebClient") WebClient embeddingsWebClient,
                                     @Value("${docchat.embeddings.model:all-MiniLM-L6-v2}") String model,
                                     @Value("${docchat.embeddings.dimensions:384}") int dimensions,
                                     @Value("${docchat.embeddings.timeout-seconds:30}") long timeoutSeconds,
                                     @Value("${docchat.embeddings.max-input-chars:10000}") int maxInputChars) {
        this.embeddingsWebClient = embeddingsWebClient;
        this.model = model;
        this.dimensions = dimensions;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
        this.maxInputChars = maxInputChars;
    }

    @Override
    public EmbeddingBatch embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            throw new ValidationException("No text provided for embedding");
        }
        List<String> inputs = prepareInputs(texts);
        EmbedResponse response;
        try {
            response = embeddingsWebClient.post()
                    .uri("/embed")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new EmbedRequest(inputs, model))
                    .retrieve()
                    .bodyToMono(EmbedResponse.class)
                    .timeout(timeout)
                    .onErrorResume(throwable -> {
                        log.error("Embeddings service call failed: {}", throwable.getMessage());
                        return Mono.error(new EmbeddingException("Failed to compute embeddings", throwable));
                    })
                    .block();
        } catch (EmbeddingException ex) {
            throw ex;
        } catch (Exception e) {
            throw new EmbeddingException("Failed to compute embeddings", e);
        }
        return validate(response, inputs.size());
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    private List<String> prepareInputs(List<String> texts) {
        List<String> inputs = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            if (text == null || text.isBlank()) {
                throw new ValidationException("Text at position " + i + " is empty and cannot be embedded");
            }
            if (text.length() > maxInputChars) {
                log.warn("Text at position {} is too long ({} chars), truncating to {}", i, text.length(), maxInputChars);
                text = text.substring(0, maxInputChars);
            }
            inputs.add(text);
        }
        return inputs;
    }

    private EmbeddingBatch validate(EmbedResponse response, int expected) {
        if (response == null || response.vectors() == null || response.vectors().isEmpty()) {
            throw new EmbeddingException("Embeddings service returned no vectors");
        }
        if (response.model() != null && !response.model().equals(model)) {
            throw new EmbeddingException("Embeddings service answered with model " + response.model()
                    + " but " + model + " is configured");
        }
        if (response.vectors().size() != expected) {
            throw new EmbeddingException("Embeddings response size " + response.vectors().size()
                    + " did not match " + expected + " inputs");
        }
        List<List<Double>> normalized = new ArrayList<>(expected);
        for (List<Double> vector : response.vectors()) {
            if (vector == null || vector.size() != dimensions) {
                throw new EmbeddingException("Embedding dimension " + (vector == null ? 0 : vector.size())
                        + " did not match configured dimension " + dimensions);
            }
            try {
                normalized.add(VectorMath.normalize(vector));
            } catch (IllegalArgumentException ex) {
                throw new EmbeddingException("Embeddings service returned a zero vector", ex);
            }
        }
        return new EmbeddingBatch(List.copyOf(normalized), model, dimensions);
    }

    private record EmbedRequest(List<String> texts, String model) {}

    private record EmbedResponse(List<List<Double>> vectors, String model, Integer dimensions) {}
}
