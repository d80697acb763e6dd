package com.finsolve.assistant.service.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

@Component
public class WebClientEmbeddingsClient implements EmbeddingsClient {

    private static final Logger log = LoggerFactory.getLogger(WebClientEmbeddingsClient.class);

    private final WebClient embeddingsWebClient;

    public WebClientEmbeddingsClient(@Qualifier("embeddingsWebClient") WebClient embeddingsWebClient) {
        this.embeddingsWebClient = embeddingsWebClient;
    }

    @Override
    public Mono<EmbeddingBatch> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return Mono.error(new IllegalArgumentException("No text provided for embedding"));
        }
        return embeddingsWebClient.post()
                .uri("/embed")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new EmbedRequest(texts))
                .retrieve()
                .bodyToMono(EmbedResponse.class)
                .doOnError(throwable -> log.warn("Embeddings service call failed: {}", throwable.getMessage()))
                .flatMap(response -> {
                    if (response.vectors() == null || response.vectors().size() != texts.size()) {
                        return Mono.error(new IllegalStateException("Embeddings service returned "
                                + (response.vectors() == null ? 0 : response.vectors().size())
                                + " vectors for " + texts.size() + " texts"));
                    }
                    return Mono.just(new EmbeddingBatch(response.vectors(), response.model(), response.dimensions()));
                });
    }

    private record EmbedRequest(List<String> texts) {}

    private record EmbedResponse(List<List<Double>> vectors, String model, int dimensions) {}
}
