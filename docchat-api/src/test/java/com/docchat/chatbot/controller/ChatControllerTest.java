package com.docchat.chatbot.controller;

import com.docchat.chatbot.error.EmbeddingException;
import com.docchat.chatbot.error.ValidationException;
import com.docchat.chatbot.model.Answer;
import com.docchat.chatbot.model.Citation;
import com.docchat.chatbot.service.ChatService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ChatControllerTest {

    private ChatService chatService;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        chatService = mock(ChatService.class);
        client = WebTestClient.bindToController(new ChatController(chatService))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void returnsAnswerWithRoundedSources() {
        Citation citation = new Citation("doc-0", "Paris is the capital of France.", "facts.txt", 0.65564);
        when(chatService.answer("What is the capital of France?"))
                .thenReturn(Mono.just(new Answer("Paris is the capital of France.", List.of(citation), false)));

        client.post().uri("/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "What is the capital of France?"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.answer").isEqualTo("Paris is the capital of France.")
                .jsonPath("$.sources[0].source").isEqualTo("facts.txt")
                .jsonPath("$.sources[0].text").isEqualTo("Paris is the capital of France.")
                .jsonPath("$.sources[0].score").isEqualTo(0.656);
    }

    @Test
    void missingQueryIsRejected() {
        client.post().uri("/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", " "))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("VALIDATION");
        verifyNoInteractions(chatService);
    }

    @Test
    void serviceValidationErrorIsBadRequest() {
        when(chatService.answer(anyString())).thenReturn(Mono.error(new ValidationException("Query cannot be empty")));

        client.post().uri("/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "x"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.detail").isEqualTo("Query cannot be empty");
    }

    @Test
    void embeddingOutageIsBadGateway() {
        when(chatService.answer(anyString())).thenReturn(Mono.error(new EmbeddingException("Embedding service is unavailable")));

        client.post().uri("/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "anything"))
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error").isEqualTo("EMBEDDING")
                .jsonPath("$.detail").isEqualTo("Embedding service is unavailable");
    }

    @Test
    void unexpectedErrorsHideTheirMessage() {
        when(chatService.answer(anyString())).thenReturn(Mono.error(new IllegalStateException("secret internals")));

        client.post().uri("/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "anything"))
                .exchange()
                .expectStatus().isEqualTo(500)
                .expectBody()
                .jsonPath("$.error").isEqualTo("INTERNAL")
                .jsonPath("$.detail").isEqualTo("Internal server error");
    }
}
