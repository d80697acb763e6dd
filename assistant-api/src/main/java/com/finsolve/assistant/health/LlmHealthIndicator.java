package com.finsolve.assistant.health;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.AbstractReactiveHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Reports whether the chat completion provider lists models for the configured
 * API key. The model name is exposed as a detail; the key never is.
 */
@Component("llm")
public class LlmHealthIndicator extends AbstractReactiveHealthIndicator {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final WebClient llmWebClient;
    private final String model;

    public LlmHealthIndicator(@Qualifier("llmWebClient") WebClient llmWebClient,
                              @Value("${chat.llm.model:llama-3.1-8b-instant}") String model) {
        super("LLM health check failed");
        this.llmWebClient = llmWebClient;
        this.model = model;
    }

    @Override
    protected Mono<Health> doHealthCheck(Health.Builder builder) {
        builder.withDetail("model", model);
        return llmWebClient.get()
                .uri("/v1/models")
                .retrieve()
                .toBodilessEntity()
                .timeout(TIMEOUT)
                .map(response -> builder.up().build());
    }
}
