package com.finsolve.assistant.service.retrieval;

import com.finsolve.assistant.access.DocumentCollection;
import reactor.core.publisher.Mono;

import java.util.List;

public interface VectorIndexClient {

    /**
     * Returns up to {@code k} hits from one collection, best first. A collection
     * that has not been created yet yields an empty list.
     */
    Mono<List<IndexHit>> similaritySearch(DocumentCollection collection, String queryText, int k);
}
