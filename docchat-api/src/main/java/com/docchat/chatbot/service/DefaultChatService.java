package com.docchat.chatbot.service;

import com.docchat.chatbot.error.EmbeddingException;
import com.docchat.chatbot.error.ValidationException;
import com.docchat.chatbot.error.VectorStoreException;
import com.docchat.chatbot.model.Answer;
import com.docchat.chatbot.model.RetrievedChunk;
import com.docchat.chatbot.service.embedding.EmbeddingsClient;
import com.docchat.chatbot.service.orchestration.AnswerSynthesizer;
import com.docchat.chatbot.service.retrieval.DenseRetriever;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

@Service
public class DefaultChatService implements ChatService {

    private static final Logger log = LoggerFactory.getLogger(DefaultChatService.class);

    private final EmbeddingsClient embeddingsClient;
    private final DenseRetriever retriever;
    private final AnswerSynthesizer answerSynthesizer;
    private final MeterRegistry meterRegistry;
    private final Timer chatTimer;
    private final Duration timeout;

    public DefaultChatService(EmbeddingsClient embeddingsClient,
                              DenseRetriever retriever,
                              AnswerSynthesizer answerSynthesizer,
                              MeterRegistry meterRegistry,
                              @Value("${docchat.chat.timeout-seconds:20}") long timeoutSeconds) {
        this.embeddingsClient = embeddingsClient;
        this.retriever = retriever;
        this.answerSynthesizer = answerSynthesizer;
        this.meterRegistry = meterRegistry;
        this.chatTimer = meterRegistry.timer("docchat.chat.duration");
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    @Override
    public Mono<Answer> answer(String query) {
        if (query == null || query.isBlank()) {
            return Mono.error(new ValidationException("Query cannot be empty"));
        }
        String question = query.trim();
        return Mono.defer(() -> {
            Timer.Sample sample = Timer.start(meterRegistry);
            long deadline = System.nanoTime() + timeout.toNanos();
            log.info("Chat query: {}", question);
            return Mono.fromCallable(() -> embeddingsClient.embedOne(question))
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(remaining(deadline))
                    .onErrorMap(TimeoutException.class,
                            ex -> new EmbeddingException("Embedding exceeded the chat time budget", ex))
                    .flatMap(vector -> retrieve(vector, deadline))
                    .flatMap(candidates -> synthesize(question, candidates, deadline))
                    .doOnNext(this::countAnswer)
                    .doFinally(signal -> sample.stop(chatTimer));
        });
    }

    private Mono<List<RetrievedChunk>> retrieve(List<Double> vector, long deadline) {
        return Mono.fromCallable(() -> retriever.retrieve(vector))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(remaining(deadline))
                .onErrorMap(TimeoutException.class,
                        ex -> new VectorStoreException("Vector search exceeded the chat time budget", ex));
    }

    private Mono<Answer> synthesize(String question, List<RetrievedChunk> candidates, long deadline) {
        if (candidates.isEmpty()) {
            return Mono.just(answerSynthesizer.fallback(question, candidates));
        }
        long remainingNanos = deadline - System.nanoTime();
        if (remainingNanos <= 0) {
            log.warn("No time left for answer generation, using fallback");
            return Mono.just(answerSynthesizer.fallback(question, candidates));
        }
        return Mono.fromCallable(() -> answerSynthesizer.synthesize(question, candidates))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(Duration.ofNanos(remainingNanos))
                .onErrorResume(TimeoutException.class, ex -> {
                    log.warn("Answer generation exceeded {}s, using fallback", timeout.toSeconds());
                    return Mono.fromCallable(() -> answerSynthesizer.fallback(question, candidates));
                });
    }

    private static Duration remaining(long deadline) {
        return Duration.ofNanos(Math.max(1, deadline - System.nanoTime()));
    }

    private void countAnswer(Answer answer) {
        meterRegistry.counter("docchat.chat.answers", "path", answer.fallback() ? "fallback" : "generated").increment();
    }
}
