package com.finsolve.assistant.model;

import java.util.List;

public record RankedResult(List<RankedChunk> chunks) {

    public RankedResult {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }

    public static RankedResult empty() {
        return new RankedResult(List.of());
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public int size() {
        return chunks.size();
    }

    public RankedChunk get(int index) {
        return chunks.get(index);
    }

    public RankedResult limit(int count) {
        if (count >= chunks.size()) {
            return this;
        }
        return new RankedResult(chunks.subList(0, Math.max(0, count)));
    }
}
