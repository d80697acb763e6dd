package com.finsolve.assistant.model;

/**
 * A chunk surfaced by one query variant, before cross-variant merging.
 */
public record RetrievalHit(int variantIndex, RetrievedChunk chunk) {
}
