package com.finsolve.assistant.health;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.AbstractReactiveHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Reports whether Qdrant answers its readiness endpoint.
 */
@Component("vectorIndex")
public class VectorIndexHealthIndicator extends AbstractReactiveHealthIndicator {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private final WebClient qdrantWebClient;

    public VectorIndexHealthIndicator(@Qualifier("qdrantWebClient") WebClient qdrantWebClient) {
        super("Qdrant health check failed");
        this.qdrantWebClient = qdrantWebClient;
    }

    @Override
    protected Mono<Health> doHealthCheck(Health.Builder builder) {
        return qdrantWebClient.get()
                .uri("/readyz")
                .retrieve()
                .toBodilessEntity()
                .timeout(TIMEOUT)
                .map(response -> builder.up()
                        .withDetail("status", response.getStatusCode().value())
                        .build());
    }
}
