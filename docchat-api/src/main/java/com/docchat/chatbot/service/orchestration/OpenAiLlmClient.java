package com.docchat.chatbot.service.orchestration;

import com.docchat.chatbot.error.SynthesisException;
import com.docchat.chatbot.model.RetrievedChunk;
import com.docchat.chatbot.service.orchestration.openai.OpenAiChatClient;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;

@Component
@ConditionalOnProperty(name = "docchat.llm.enabled", havingValue = "true")
public class OpenAiLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiLlmClient.class);

    private final OpenAiChatClient chatClient;
    private final MeterRegistry meterRegistry;
    private final String model;
    private final double temperature;
    private final int maxOutputTokens;
    private final double repetitionPenalty;

    public OpenAiLlmClient(OpenAiChatClient chatClient,
                           MeterRegistry meterRegistry,
                           @Value("${docchat.llm.model:google/flan-t5-base}") String model,
                           @Value("${docchat.llm.temperature:0.3}") double temperature,
                           @Value("${docchat.llm.max-output-tokens:200}") int maxOutputTokens,
                           @Value("${docchat.llm.repetition-penalty:1.2}") double repetitionPenalty) {
        this.chatClient = chatClient;
        this.meterRegistry = meterRegistry;
        this.model = Objects.requireNonNullElse(model, "google/flan-t5-base");
        this.temperature = temperature;
        this.maxOutputTokens = Math.max(16, maxOutputTokens);
        this.repetitionPenalty = repetitionPenalty;
    }

    @Override
    public String generate(LlmRequest request) {
        List<OpenAiChatClient.Message> messages = List.of(
                new OpenAiChatClient.Message("system", request.systemPrompt()),
                new OpenAiChatClient.Message("user", buildUserPrompt(request))
        );
        OpenAiChatClient.ChatCompletionResponse response = chatClient.complete(new OpenAiChatClient.Request(
                model, messages, temperature, maxOutputTokens, Map.of("repetition_penalty", repetitionPenalty)));
        if (response != null) {
            recordUsage(response.usage());
        }
        OpenAiChatClient.Choice choice = response == null ? null : response.firstChoice();
        if (choice == null || choice.message() == null || choice.message().content() == null
                || choice.message().content().isBlank()) {
            log.warn("LLM returned no content for model {}", model);
            throw new SynthesisException("LLM returned an empty answer");
        }
        if ("length".equals(choice.finishReason())) {
            log.debug("LLM answer hit the {} token limit", maxOutputTokens);
        }
        return choice.message().content().trim();
    }

    private void recordUsage(OpenAiChatClient.Usage usage) {
        if (usage == null) {
            return;
        }
        log.debug("LLM usage for model {}: {} prompt, {} completion tokens", model, usage.promptTokens(), usage.completionTokens());
        meterRegistry.counter("docchat.llm.tokens", "type", "prompt").increment(usage.promptTokens());
        meterRegistry.counter("docchat.llm.tokens", "type", "completion").increment(usage.completionTokens());
    }

    private String buildUserPrompt(LlmRequest request) {
        StringBuilder builder = new StringBuilder();
        builder.append("DOCUMENT EXCERPTS:\n")
                .append(renderContext(request.context()))
                .append("\nQUESTION: ")
                .append(request.question() == null ? "" : request.question().trim())
                .append("\n\nINSTRUCTIONS:\n")
                .append("- Answer in a clear, complete sentence\n")
                .append("- Do not use bullet points or numbered lists\n")
                .append("- Reference the excerpts if they contain the answer\n")
                .append("- If excerpts conflict, mention any uncertainties\n")
                .append("\nANSWER:");
        return builder.toString();
    }

    private String renderContext(List<RetrievedChunk> context) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < context.size(); i++) {
            RetrievedChunk chunk = context.get(i);
            builder.append("[Excerpt ")
                    .append(i + 1)
                    .append(" from ")
                    .append(chunk.source() == null || chunk.source().isBlank() ? "unknown source" : chunk.source())
                    .append("]: ")
                    .append(clean(chunk.text()))
                    .append("\n\n");
        }
        return builder.toString();
    }

    private String clean(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("^[^a-zA-Z0-9\"']+", "")
                .replaceAll("[^a-zA-Z0-9\"'.!?]+$", "");
    }
}
