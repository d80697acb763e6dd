package com.finsolve.assistant.config;

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
    public WebClient qdrantWebClient(@Value("${chat.qdrant.base-url:http://localhost:6333}") String baseUrl,
                                     @Value("${chat.qdrant.api-key:}") String apiKey) {
        WebClient.Builder builder = baseBuilder(baseUrl);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader("api-key", apiKey);
        }
        return builder.build();
    }

    @Bean
    public WebClient embeddingsWebClient(@Value("${chat.embeddings.base-url:http://localhost:9000}") String baseUrl) {
        return baseBuilder(baseUrl).build();
    }

    @Bean
    public WebClient llmWebClient(@Value("${chat.llm.base-url:https://api.groq.com/openai}") String baseUrl,
                                  @Value("${chat.llm.api-key:}") String apiKey,
                                  @Value("${chat.llm.timeout-seconds:30}") long timeoutSeconds) {
        WebClient.Builder builder = baseBuilder(baseUrl);
        if (timeoutSeconds > 0) {
            HttpClient httpClient = HttpClient.create()
                    .responseTimeout(Duration.ofSeconds(timeoutSeconds));
            builder.clientConnector(new ReactorClientHttpConnector(httpClient));
        }
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        builder.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        builder.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        return builder.build();
    }

    private WebClient.Builder baseBuilder(String baseUrl) {
        return WebClient.builder()
                .baseUrl(baseUrl)
                .exchangeStrategies(exchangeStrategies());
    }

    private ExchangeStrategies exchangeStrategies() {
        return ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();
    }
}
