package com.finsolve.assistant.service.retrieval;

import com.finsolve.assistant.config.RagProperties;
import com.finsolve.assistant.model.RankedChunk;
import com.finsolve.assistant.model.RankedResult;
import com.finsolve.assistant.model.RetrievalHit;
import com.finsolve.assistant.model.RetrievedChunk;
import org.springframework.stereotype.Component;

import java.util.BitSet;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class ChunkRanker {

    private static final Comparator<RankedChunk> ORDER = Comparator
            .comparingDouble(RankedChunk::score).reversed()
            .thenComparing(Comparator.comparingInt(RankedChunk::matchCount).reversed())
            .thenComparing(ranked -> ranked.chunk().documentId(), Comparator.nullsLast(String::compareTo))
            .thenComparingInt(ranked -> ranked.chunk().offset())
            .thenComparing(ranked -> ranked.chunk().collection());

    private final RagProperties properties;

    public ChunkRanker(RagProperties properties) {
        this.properties = properties;
    }

    /**
     * Deduplicates hits by chunk id keeping the best score, counts the distinct
     * variants that surfaced each chunk, and returns the top-K in a fully
     * deterministic order.
     */
    public RankedResult merge(List<RetrievalHit> hits) {
        if (hits == null || hits.isEmpty()) {
            return RankedResult.empty();
        }
        Map<String, MergedChunk> merged = new LinkedHashMap<>();
        for (RetrievalHit hit : hits) {
            merged.merge(hit.chunk().chunkId(), MergedChunk.of(hit), MergedChunk::merge);
        }
        List<RankedChunk> ranked = merged.values().stream()
                .map(MergedChunk::toRanked)
                .sorted(ORDER)
                .limit(properties.getTopK())
                .toList();
        return new RankedResult(ranked);
    }

    private record MergedChunk(RetrievedChunk best, BitSet variants) {

        static MergedChunk of(RetrievalHit hit) {
            BitSet variants = new BitSet();
            variants.set(hit.variantIndex());
            return new MergedChunk(hit.chunk(), variants);
        }

        MergedChunk merge(MergedChunk other) {
            BitSet union = (BitSet) variants.clone();
            union.or(other.variants);
            RetrievedChunk winner = other.best.score() > best.score() ? other.best : best;
            return new MergedChunk(winner, union);
        }

        RankedChunk toRanked() {
            return new RankedChunk(best, variants.cardinality());
        }
    }
}
