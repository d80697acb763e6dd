package com.finsolve.assistant.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public record GeneratedAnswer(
        String text,
        List<Citation> citations,
        double confidence,
        int tokenCount,
        Set<PipelineWarning> warnings
) {

    public GeneratedAnswer {
        citations = citations == null ? List.of() : List.copyOf(citations);
        warnings = warnings == null || warnings.isEmpty() ? Set.of() : Set.copyOf(warnings);
    }

    public GeneratedAnswer withWarnings(Set<PipelineWarning> additional) {
        if (additional == null || additional.isEmpty()) {
            return this;
        }
        EnumSet<PipelineWarning> merged = EnumSet.noneOf(PipelineWarning.class);
        merged.addAll(warnings);
        merged.addAll(additional);
        return new GeneratedAnswer(text, citations, confidence, tokenCount, merged);
    }
}
