package com.finsolve.assistant.service.retrieval;

import com.finsolve.assistant.model.RetrievalHit;

import java.util.List;

/**
 * Unmerged, thresholded hits of one fan-out plus the number of searches that
 * failed or timed out.
 */
public record RetrievalOutcome(List<RetrievalHit> hits, int searches, int failedSearches) {

    public RetrievalOutcome {
        hits = hits == null ? List.of() : List.copyOf(hits);
    }

    public static RetrievalOutcome empty() {
        return new RetrievalOutcome(List.of(), 0, 0);
    }

    public boolean degraded() {
        return failedSearches > 0;
    }
}
