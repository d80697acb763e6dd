package com.finsolve.assistant.model;

/**
 * Non-fatal degradations reported alongside an answer.
 */
public enum PipelineWarning {
    CONTEXTUALIZATION_FALLBACK,
    AUGMENTATION_FALLBACK,
    DEGRADED_RETRIEVAL,
    NO_CONTEXT,
    CONTEXT_TRUNCATED
}
