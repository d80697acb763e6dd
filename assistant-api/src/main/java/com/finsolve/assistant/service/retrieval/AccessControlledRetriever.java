package com.finsolve.assistant.service.retrieval;

import com.finsolve.assistant.access.AccessScope;
import com.finsolve.assistant.access.DocumentCollection;
import com.finsolve.assistant.config.RagProperties;
import com.finsolve.assistant.model.RetrievalHit;
import com.finsolve.assistant.model.RetrievedChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs one similarity search per (variant, collection) pair of the caller's scope,
 * in parallel up to the configured concurrency. Collections outside the scope are
 * never searched and hits under the similarity threshold are dropped. A search
 * that fails or exceeds the per-call timeout contributes nothing and marks the
 * outcome degraded.
 */
@Service
public class AccessControlledRetriever {

    private static final Logger log = LoggerFactory.getLogger(AccessControlledRetriever.class);

    private final VectorIndexClient vectorIndex;
    private final RagProperties properties;

    public AccessControlledRetriever(VectorIndexClient vectorIndex, RagProperties properties) {
        this.vectorIndex = vectorIndex;
        this.properties = properties;
    }

    public Mono<RetrievalOutcome> retrieve(List<String> variants, AccessScope scope) {
        if (variants == null || variants.isEmpty() || scope == null) {
            return Mono.just(RetrievalOutcome.empty());
        }
        List<Search> searches = plan(variants, scope);
        return Flux.fromIterable(searches)
                .flatMap(this::execute, properties.getRetrievalConcurrency())
                .collectList()
                .map(results -> assemble(results, searches.size()));
    }

    private List<Search> plan(List<String> variants, AccessScope scope) {
        List<Search> searches = new ArrayList<>();
        List<DocumentCollection> collections = scope.orderedCollections();
        for (int variantIndex = 0; variantIndex < variants.size(); variantIndex++) {
            for (DocumentCollection collection : collections) {
                searches.add(new Search(searches.size(), variantIndex, variants.get(variantIndex), collection));
            }
        }
        return searches;
    }

    private Mono<SearchResult> execute(Search search) {
        double threshold = properties.getSimilarityThreshold();
        return vectorIndex.similaritySearch(search.collection(), search.text(), properties.getTopK())
                .timeout(properties.retrievalTimeout())
                .map(hits -> hits.stream()
                        .filter(hit -> hit.score() >= threshold)
                        .map(hit -> new RetrievalHit(search.variantIndex(), toChunk(hit, search.collection())))
                        .toList())
                .map(hits -> new SearchResult(search, hits, false))
                .onErrorResume(error -> {
                    log.warn("Skipping {} for variant {}: {}", search.collection().indexName(),
                            search.variantIndex(), error.toString());
                    return Mono.just(new SearchResult(search, List.of(), true));
                });
    }

    private RetrievedChunk toChunk(IndexHit hit, DocumentCollection collection) {
        return new RetrievedChunk(hit.documentId(), hit.offset(), collection, hit.text(), hit.score(),
                hit.documentName(), hit.uploaderRole());
    }

    private RetrievalOutcome assemble(List<SearchResult> results, int searchCount) {
        List<SearchResult> ordered = results.stream()
                .sorted(Comparator.comparingInt(result -> result.search().sequence()))
                .toList();
        List<RetrievalHit> hits = new ArrayList<>();
        int failed = 0;
        for (SearchResult result : ordered) {
            hits.addAll(result.hits());
            if (result.failed()) {
                failed++;
            }
        }
        if (failed > 0) {
            log.warn("Retrieval degraded: {} of {} searches failed", failed, searchCount);
        }
        log.debug("Retrieved {} hits above threshold from {} searches", hits.size(), searchCount);
        return new RetrievalOutcome(hits, searchCount, failed);
    }

    private record Search(int sequence, int variantIndex, String text, DocumentCollection collection) {}

    private record SearchResult(Search search, List<RetrievalHit> hits, boolean failed) {}
}
