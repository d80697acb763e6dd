package com.finsolve.assistant.service.postprocess;

import com.finsolve.assistant.config.RagProperties;
import com.finsolve.assistant.model.RankedChunk;
import com.finsolve.assistant.model.RankedResult;
import org.springframework.stereotype.Component;

/**
 * Confidence in [0,1], rounded to three decimals:
 * {@code base = 0.6 * topScore + 0.4 * passing / topK}, blended as
 * {@code 0.8 * base + 0.2 * certainty} when the backend reports a certainty.
 * Zero whenever no chunk reaches the similarity threshold.
 */
@Component
public class ConfidenceScorer {

    static final double TOP_SCORE_WEIGHT = 0.6;
    static final double COVERAGE_WEIGHT = 0.4;
    static final double CERTAINTY_WEIGHT = 0.2;

    private final RagProperties properties;

    public ConfidenceScorer(RagProperties properties) {
        this.properties = properties;
    }

    public double score(RankedResult included, Double certainty) {
        if (included == null || included.isEmpty()) {
            return 0.0;
        }
        double threshold = properties.getSimilarityThreshold();
        long passing = included.chunks().stream().filter(chunk -> chunk.score() >= threshold).count();
        if (passing == 0) {
            return 0.0;
        }
        double topScore = included.chunks().stream().mapToDouble(RankedChunk::score).max().orElse(0.0);
        double coverage = Math.min(1.0, (double) passing / Math.max(1, properties.getTopK()));
        double confidence = TOP_SCORE_WEIGHT * clamp(topScore) + COVERAGE_WEIGHT * coverage;
        if (certainty != null && !certainty.isNaN()) {
            confidence = (1 - CERTAINTY_WEIGHT) * confidence + CERTAINTY_WEIGHT * clamp(certainty);
        }
        return Math.round(clamp(confidence) * 1000.0) / 1000.0;
    }

    private double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
