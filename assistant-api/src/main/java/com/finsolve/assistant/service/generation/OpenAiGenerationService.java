package com.finsolve.assistant.service.generation;

import com.finsolve.assistant.service.generation.openai.OpenAiChatClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Component
@Profile("!template")
public class OpenAiGenerationService implements GenerationService {

    private static final Logger log = LoggerFactory.getLogger(OpenAiGenerationService.class);

    private final OpenAiChatClient chatClient;
    private final String model;
    private final double temperature;
    private final int maxAttempts;
    private final Duration backoff;
    private final boolean logprobs;

    public OpenAiGenerationService(OpenAiChatClient chatClient,
                                   @Value("${chat.llm.model:llama-3.1-8b-instant}") String model,
                                   @Value("${chat.llm.temperature:0.3}") double temperature,
                                   @Value("${chat.llm.max-attempts:2}") int maxAttempts,
                                   @Value("${chat.llm.backoff-ms:250}") long backoffMs,
                                   @Value("${chat.llm.logprobs:false}") boolean logprobs) {
        this.chatClient = chatClient;
        this.model = Objects.requireNonNullElse(model, "llama-3.1-8b-instant");
        this.temperature = temperature;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoff = Duration.ofMillis(Math.max(1, backoffMs));
        this.logprobs = logprobs;
    }

    @Override
    public Mono<Generation> generate(String prompt, int maxTokens) {
        Map<String, Object> extraParams = logprobs ? Map.of("logprobs", Boolean.TRUE) : Map.of();
        OpenAiChatClient.Request request = new OpenAiChatClient.Request(
                model,
                List.of(new OpenAiChatClient.Message("user", prompt)),
                temperature,
                maxTokens,
                extraParams
        );
        return Mono.defer(() -> chatClient.complete(request))
                .map(this::toGeneration)
                .retryWhen(Retry.backoff(maxAttempts - 1L, backoff)
                        .filter(GenerationTransientException.class::isInstance)
                        .doBeforeRetry(signal -> log.warn("Retrying generation after transient failure (attempt {} of {}): {}",
                                signal.totalRetries() + 2, maxAttempts, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()));
    }

    private Generation toGeneration(OpenAiChatClient.ChatCompletionResponse response) {
        OpenAiChatClient.Choice choice = response == null ? null : response.firstChoice();
        if (choice != null && "content_filter".equals(choice.finishReason())) {
            throw new GenerationFatalException("Chat completion was blocked by the content filter");
        }
        if (choice == null || choice.message() == null || choice.message().content() == null
                || choice.message().content().isBlank()) {
            throw new GenerationTransientException("Chat completion returned no content");
        }
        Integer tokens = response.usage() == null ? null : response.usage().totalTokens();
        return new Generation(choice.message().content().trim(), tokens, certainty(choice.logprobs()));
    }

    private Double certainty(OpenAiChatClient.Logprobs logprobs) {
        if (logprobs == null || logprobs.content() == null || logprobs.content().isEmpty()) {
            return null;
        }
        double mean = logprobs.content().stream()
                .mapToDouble(OpenAiChatClient.TokenLogprob::logprob)
                .average()
                .orElse(Double.NEGATIVE_INFINITY);
        return Math.max(0.0, Math.min(1.0, Math.exp(mean)));
    }
}
