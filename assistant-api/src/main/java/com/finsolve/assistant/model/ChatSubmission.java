package com.finsolve.assistant.model;

import jakarta.validation.constraints.NotBlank;

public record ChatSubmission(
        String conversationId,
        @NotBlank String message,
        Boolean includeSources
) {

    public boolean includeSourcesOrDefault() {
        return includeSources == null || includeSources;
    }
}
