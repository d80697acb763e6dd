package com.finsolve.assistant.service.retrieval;

import com.finsolve.assistant.access.DocumentCollection;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Vector index fake for tests. Every stored hit is returned for every query with
 * its stored score; collections can be made to fail or to hang.
 */
public class InMemoryVectorIndex implements VectorIndexClient {

    private final Map<DocumentCollection, List<IndexHit>> hits = new EnumMap<>(DocumentCollection.class);
    private final Set<DocumentCollection> failing = EnumSet.noneOf(DocumentCollection.class);
    private final Set<DocumentCollection> hanging = EnumSet.noneOf(DocumentCollection.class);
    private final Queue<String> searches = new ConcurrentLinkedQueue<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private Duration latency = Duration.ZERO;

    public InMemoryVectorIndex add(DocumentCollection collection, String documentId, int offset, double score, String text) {
        hits.computeIfAbsent(collection, key -> new ArrayList<>())
                .add(new IndexHit(documentId, offset, text, score, documentId + ".md", collection.department()));
        return this;
    }

    public InMemoryVectorIndex failing(DocumentCollection collection) {
        failing.add(collection);
        return this;
    }

    public InMemoryVectorIndex hanging(DocumentCollection collection) {
        hanging.add(collection);
        return this;
    }

    public InMemoryVectorIndex latency(Duration latency) {
        this.latency = latency;
        return this;
    }

    @Override
    public Mono<List<IndexHit>> similaritySearch(DocumentCollection collection, String queryText, int k) {
        searches.add(collection.name() + ":" + queryText);
        if (failing.contains(collection)) {
            return Mono.error(new IllegalStateException(collection.indexName() + " is unreachable"));
        }
        if (hanging.contains(collection)) {
            return Mono.never();
        }
        List<IndexHit> result = hits.getOrDefault(collection, List.of()).stream()
                .sorted(Comparator.comparingDouble(IndexHit::score).reversed())
                .limit(k)
                .toList();
        return Mono.just(result)
                .delayElement(latency)
                .doOnSubscribe(subscription -> maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max))
                .doFinally(signal -> inFlight.decrementAndGet());
    }

    public List<String> searches() {
        return List.copyOf(searches);
    }

    public boolean searched(DocumentCollection collection) {
        return searches.stream().anyMatch(search -> search.startsWith(collection.name() + ":"));
    }

    public int maxInFlight() {
        return maxInFlight.get();
    }
}
