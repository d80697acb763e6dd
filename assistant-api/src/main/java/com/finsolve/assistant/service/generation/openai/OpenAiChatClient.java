package com.finsolve.assistant.service.generation.openai;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.finsolve.assistant.service.generation.GenerationFatalException;
import com.finsolve.assistant.service.generation.GenerationTransientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

@Component
public class OpenAiChatClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiChatClient.class);

    private final WebClient webClient;
    private final Duration timeout;

    public OpenAiChatClient(@Qualifier("llmWebClient") WebClient webClient,
                            @Value("${chat.llm.timeout-seconds:30}") long timeoutSeconds) {
        this.webClient = webClient;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    public Mono<ChatCompletionResponse> complete(Request request) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", request.model());
        payload.put("messages", request.messages());
        payload.put("stream", Boolean.FALSE);
        if (request.temperature() != null) {
            payload.put("temperature", request.temperature());
        }
        if (request.maxTokens() != null) {
            payload.put("max_tokens", request.maxTokens());
        }
        if (request.extraParams() != null && !request.extraParams().isEmpty()) {
            payload.putAll(request.extraParams());
        }

        return webClient.post()
                .uri("/v1/chat/completions")
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(ChatCompletionResponse.class)
                .timeout(timeout)
                .onErrorMap(this::translate);
    }

    private Throwable translate(Throwable error) {
        if (error instanceof GenerationTransientException || error instanceof GenerationFatalException) {
            return error;
        }
        if (error instanceof WebClientResponseException response) {
            HttpStatusCode status = response.getStatusCode();
            log.warn("LLM chat completion returned {}: {}", status.value(), response.getResponseBodyAsString());
            if (isRetryable(status)) {
                return new GenerationTransientException("Chat completion returned " + status.value(), response);
            }
            return new GenerationFatalException("Chat completion returned " + status.value(), response);
        }
        if (error instanceof TimeoutException || error instanceof WebClientRequestException) {
            log.warn("LLM chat completion did not answer: {}", error.getMessage());
            return new GenerationTransientException("Chat completion timed out or was unreachable", error);
        }
        log.warn("LLM chat completion failed: {}", error.getMessage(), error);
        return new GenerationFatalException("Failed to invoke chat completion", error);
    }

    private boolean isRetryable(HttpStatusCode status) {
        return status.value() == 429 || status.value() == 408 || status.is5xxServerError();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Request(String model,
                          List<Message> messages,
                          Double temperature,
                          Integer maxTokens,
                          Map<String, Object> extraParams) {
    }

    public record Message(String role, String content) {
    }

    public record ChatCompletionResponse(List<Choice> choices, Usage usage) {

        public Choice firstChoice() {
            return choices == null || choices.isEmpty() ? null : choices.get(0);
        }
    }

    public record Choice(Message message,
                         @JsonProperty("finish_reason") String finishReason,
                         Logprobs logprobs) {
    }

    public record Logprobs(List<TokenLogprob> content) {
    }

    public record TokenLogprob(String token, double logprob) {
    }

    public record Usage(@JsonProperty("total_tokens") Integer totalTokens,
                        @JsonProperty("prompt_tokens") Integer promptTokens,
                        @JsonProperty("completion_tokens") Integer completionTokens) {
    }
}
