package com.finsolve.assistant.service.retrieval;

import reactor.core.publisher.Mono;

import java.util.List;

public interface EmbeddingsClient {

    Mono<EmbeddingBatch> embed(List<String> texts);

    record EmbeddingBatch(List<List<Double>> vectors, String model, int dimensions) {}
}
