package com.finsolve.assistant.model;

/**
 * A ranked context item backing an answer. {@code cited} is false when the model
 * named no sources and the whole ranked list is attached instead.
 */
public record Citation(int index,
                       String documentName,
                       String department,
                       double score,
                       String excerpt,
                       boolean cited) {
}
