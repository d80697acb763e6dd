package com.finsolve.assistant.service.retrieval;

/**
 * One candidate returned by a similarity search against a single collection.
 */
public record IndexHit(String documentId,
                       int offset,
                       String text,
                       double score,
                       String documentName,
                       String uploaderRole) {
}
