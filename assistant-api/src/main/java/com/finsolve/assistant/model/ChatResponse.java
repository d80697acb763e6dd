package com.finsolve.assistant.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;

public record ChatResponse(
        String conversationId,
        String message,
        List<Citation> sources,
        double confidence,
        int tokensUsed,
        Set<PipelineWarning> warnings,
        OffsetDateTime timestamp
) {
}
