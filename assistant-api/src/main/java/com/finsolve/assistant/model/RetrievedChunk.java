package com.finsolve.assistant.model;

import com.finsolve.assistant.access.DocumentCollection;

public record RetrievedChunk(
        String documentId,
        int offset,
        DocumentCollection collection,
        String text,
        double score,
        String documentName,
        String uploaderRole
) {

    public String chunkId() {
        return (documentId == null ? "" : documentId) + "#" + offset;
    }
}
