package com.finsolve.assistant.service.conversation;

import com.finsolve.assistant.config.RagProperties;
import com.finsolve.assistant.model.ChatMessageRole;
import com.finsolve.assistant.model.ConversationContext;
import com.finsolve.assistant.model.ConversationTurn;
import com.finsolve.assistant.service.generation.GenerationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.regex.Pattern;

@Component
public class ConversationContextManager {

    private static final Logger log = LoggerFactory.getLogger(ConversationContextManager.class);

    private static final String REWRITE_TEMPLATE = """
            Given the following conversation and a follow-up question, rephrase the follow-up question \
            to be a standalone question that can be understood without the conversation. Resolve pronouns \
            and references, keep every detail needed to answer it, and return only the question.

            Chat history:
            %s

            Follow-up question: %s
            Standalone question:""";

    private static final Pattern LEADING_LABEL = Pattern.compile("(?i)^\\s*(standalone question|question)\\s*:\\s*");

    private final GenerationService generationService;
    private final RagProperties properties;

    public ConversationContextManager(GenerationService generationService, RagProperties properties) {
        this.generationService = generationService;
        this.properties = properties;
    }

    /**
     * Rewrites {@code message} into a question that stands on its own, using at
     * most the configured number of most recent turns. Without history the message
     * is returned unchanged; a failed rewrite falls back to the message.
     */
    public Mono<StandaloneQuery> buildStandaloneQuery(ConversationContext history, String message) {
        ConversationContext bounded = history == null
                ? ConversationContext.empty(null)
                : ConversationContext.bounded(history.conversationId(), history.turns(), properties.getChunkHistoryLimit());
        if (bounded.isEmpty()) {
            return Mono.just(new StandaloneQuery(message, false));
        }
        String prompt = REWRITE_TEMPLATE.formatted(render(bounded), message);
        return generationService.generate(prompt, properties.getRewriteMaxTokens())
                .map(generation -> clean(generation.text()))
                .filter(text -> !text.isBlank())
                .map(text -> new StandaloneQuery(text, false))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("Contextualization returned no question for conversation {}, using raw message",
                            bounded.conversationId());
                    return new StandaloneQuery(message, true);
                }))
                .onErrorResume(error -> {
                    log.warn("Contextualization failed for conversation {}, using raw message: {}",
                            bounded.conversationId(), error.getMessage());
                    return Mono.just(new StandaloneQuery(message, true));
                });
    }

    private String render(ConversationContext context) {
        StringBuilder builder = new StringBuilder();
        for (ConversationTurn turn : context.turns()) {
            builder.append(turn.role() == ChatMessageRole.USER ? "User: " : "Assistant: ")
                    .append(turn.content())
                    .append('\n');
        }
        return builder.toString().trim();
    }

    private String clean(String text) {
        if (text == null) {
            return "";
        }
        String firstLine = text.strip().lines().findFirst().orElse("");
        String unlabeled = LEADING_LABEL.matcher(firstLine).replaceFirst("");
        return unlabeled.replaceAll("^[\"']+|[\"']+$", "").strip();
    }
}
