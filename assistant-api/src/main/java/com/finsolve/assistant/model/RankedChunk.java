package com.finsolve.assistant.model;

public record RankedChunk(RetrievedChunk chunk, int matchCount) {

    public double score() {
        return chunk.score();
    }
}
