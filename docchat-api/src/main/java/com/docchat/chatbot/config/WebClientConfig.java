package com.docchat.chatbot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient qdrantWebClient(@Value("${docchat.qdrant.base-url:http://localhost:6333}") String baseUrl,
                                     @Value("${docchat.qdrant.api-key:}") String apiKey) {
        WebClient.Builder builder = baseBuilder(baseUrl);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader("api-key", apiKey);
        }
        return builder.build();
    }

    @Bean
    public WebClient embeddingsWebClient(@Value("${docchat.embeddings.base-url:http://localhost:9000}") String baseUrl) {
        return baseBuilder(baseUrl).build();
    }

    @Bean
    public WebClient llmWebClient(@Value("${docchat.llm.base-url:http://localhost:1234}") String baseUrl,
                                  @Value("${docchat.llm.api-key:}") String apiKey,
                                  @Value("${docchat.llm.timeout-seconds:60}") long timeoutSeconds) {
        WebClient.Builder builder = baseBuilder(baseUrl);
        if (timeoutSeconds > 0) {
            HttpClient httpClient = HttpClient.create()
                    .responseTimeout(Duration.ofSeconds(timeoutSeconds));
            builder.clientConnector(new ReactorClientHttpConnector(httpClient));
        }
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        builder.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        return builder.build();
    }

    private WebClient.Builder baseBuilder(String baseUrl) {
        return WebClient.builder()
                .baseUrl(baseUrl)
                .exchangeStrategies(exchangeStrategies());
    }

    // embedding batches of long documents exceed the 256 KB codec default
    private ExchangeStrategies exchangeStrategies() {
        return ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }
}
