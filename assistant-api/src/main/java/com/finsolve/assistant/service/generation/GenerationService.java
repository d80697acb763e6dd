package com.finsolve.assistant.service.generation;

import reactor.core.publisher.Mono;

/**
 * Text-generation backend. Implementations signal retryable failures with
 * {@link GenerationTransientException} and everything else with
 * {@link GenerationFatalException}.
 */
public interface GenerationService {

    Mono<Generation> generate(String prompt, int maxTokens);
}
