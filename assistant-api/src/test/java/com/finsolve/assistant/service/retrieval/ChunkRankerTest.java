package com.finsolve.assistant.service.retrieval;

import com.finsolve.assistant.access.DocumentCollection;
import com.finsolve.assistant.config.RagProperties;
import com.finsolve.assistant.model.RankedChunk;
import com.finsolve.assistant.model.RankedResult;
import com.finsolve.assistant.model.RetrievalHit;
import com.finsolve.assistant.model.RetrievedChunk;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ChunkRankerTest {

    private final RagProperties properties = new RagProperties();
    private final ChunkRanker ranker = new ChunkRanker(properties);

    @Test
    void keepsMaximumScoreAndCountsDistinctVariants() {
        RankedResult result = ranker.merge(List.of(
                hit(0, "policy", 1, 0.74),
                hit(1, "policy", 1, 0.88),
                hit(2, "policy", 1, 0.80),
                hit(2, "policy", 1, 0.80),
                hit(0, "budget", 0, 0.79)
        ));

        assertThat(result.size()).isEqualTo(2);
        RankedChunk top = result.get(0);
        assertThat(top.chunk().chunkId()).isEqualTo("policy#1");
        assertThat(top.score()).isCloseTo(0.88, within(1e-9));
        assertThat(top.matchCount()).isEqualTo(3);
        assertThat(result.get(1).matchCount()).isEqualTo(1);
    }

    @Test
    void breaksScoreTiesByMatchCountThenChunkId() {
        RankedResult result = ranker.merge(List.of(
                hit(0, "zeta", 0, 0.80),
                hit(0, "beta", 3, 0.80),
                hit(0, "alpha", 7, 0.80),
                hit(1, "alpha", 7, 0.75),
                hit(0, "beta", 1, 0.80)
        ));

        assertThat(result.chunks())
                .extracting(ranked -> ranked.chunk().chunkId())
                .containsExactly("alpha#7", "beta#1", "beta#3", "zeta#0");
    }

    @Test
    void mergeIsDeterministicRegardlessOfInputOrder() {
        List<RetrievalHit> hits = new ArrayList<>();
        for (int variant = 0; variant < 4; variant++) {
            for (int doc = 0; doc < 6; doc++) {
                hits.add(hit(variant, "doc-" + doc, doc % 2, 0.7 + (doc % 3) * 0.1));
            }
        }
        List<RetrievalHit> shuffled = new ArrayList<>(hits);
        Collections.shuffle(shuffled, new Random(42));

        RankedResult first = ranker.merge(hits);
        RankedResult second = ranker.merge(hits);
        RankedResult fromShuffled = ranker.merge(shuffled);

        assertThat(second).isEqualTo(first);
        assertThat(fromShuffled.chunks()).extracting(ranked -> ranked.chunk().chunkId())
                .containsExactlyElementsOf(first.chunks().stream().map(ranked -> ranked.chunk().chunkId()).toList());
    }

    @Test
    void truncatesToTopK() {
        properties.setTopK(3);
        List<RetrievalHit> hits = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            hits.add(hit(0, "doc-" + i, 0, 0.71 + i * 0.01));
        }

        RankedResult result = ranker.merge(hits);

        assertThat(result.size()).isEqualTo(3);
        assertThat(result.chunks()).extracting(ranked -> ranked.chunk().documentId())
                .containsExactly("doc-7", "doc-6", "doc-5");
    }

    @Test
    void lengthIsMinOfTopKAndDistinctChunks() {
        RankedResult result = ranker.merge(List.of(hit(0, "a", 0, 0.9), hit(1, "a", 0, 0.8), hit(0, "b", 0, 0.7)));

        assertThat(result.size()).isEqualTo(2);
        assertThat(ranker.merge(List.of()).isEmpty()).isTrue();
    }

    private RetrievalHit hit(int variant, String documentId, int offset, double score) {
        return new RetrievalHit(variant, new RetrievedChunk(documentId, offset, DocumentCollection.GENERAL,
                "text of " + documentId, score, documentId + ".pdf", "HR"));
    }
}
