package com.finsolve.assistant.service.prompt;

import com.finsolve.assistant.access.AccessScope;
import com.finsolve.assistant.config.RagProperties;
import com.finsolve.assistant.exception.ChatPipelineException;
import com.finsolve.assistant.model.ChatMessageRole;
import com.finsolve.assistant.model.ConversationContext;
import com.finsolve.assistant.model.ConversationTurn;
import com.finsolve.assistant.model.RankedResult;
import com.finsolve.assistant.model.RetrievedChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class PromptComposer {

    private static final Logger log = LoggerFactory.getLogger(PromptComposer.class);
    private static final int HISTORY_TURN_CHARS = 500;

    private final RagProperties properties;

    public PromptComposer(RagProperties properties) {
        this.properties = properties;
    }

    /**
     * Renders the answer prompt. Whole chunks are dropped from the lowest rank up
     * until the estimate fits the token budget. The top-ranked chunk is never
     * dropped, so a prompt with context never turns into a no-context prompt.
     *
     * @throws ChatPipelineException if the prompt is over budget with only the
     *                               top-ranked chunk left, or with no context at all
     */
    public ComposedPrompt compose(String standaloneQuery,
                                  RankedResult ranked,
                                  ConversationContext history,
                                  AccessScope scope) {
        RankedResult candidates = ranked == null ? RankedResult.empty() : ranked;
        int budget = properties.getPromptTokenBudget();
        int kept = candidates.size();
        int minimum = candidates.isEmpty() ? 0 : 1;
        while (true) {
            RankedResult included = candidates.limit(kept);
            String text = render(standaloneQuery, included, history, scope);
            int estimated = TokenEstimator.estimate(text);
            if (estimated <= budget) {
                boolean truncated = kept < candidates.size();
                if (truncated) {
                    log.warn("Prompt budget {} reached, dropped {} of {} ranked chunks",
                            budget, candidates.size() - kept, candidates.size());
                }
                return new ComposedPrompt(text, included, estimated, truncated);
            }
            if (kept <= minimum) {
                throw ChatPipelineException.promptOverBudget(estimated, budget);
            }
            kept--;
        }
    }

    private String render(String question, RankedResult included, ConversationContext history, AccessScope scope) {
        StringBuilder builder = new StringBuilder();
        builder.append("You are an AI assistant for FinSolve Technologies, answering a question from a member of the ")
                .append(scope.role().tag())
                .append(" team.\n");
        if (included.isEmpty()) {
            builder.append("No documents relevant to the question were found in the collections this user can access (")
                    .append(String.join(", ", scope.departments()))
                    .append(").\n\n");
        } else {
            builder.append("Reason step by step using only the numbered context sources below, ")
                    .append("then write the final response after \"Final Answer:\".\n\n")
                    .append("Context:\n");
            for (int i = 0; i < included.size(); i++) {
                RetrievedChunk chunk = included.get(i).chunk();
                builder.append("[Source ").append(i + 1).append("] ")
                        .append(chunk.documentName() == null ? chunk.documentId() : chunk.documentName())
                        .append(" (").append(chunk.collection().department()).append(" department)\n")
                        .append(chunk.text() == null ? "" : chunk.text().strip())
                        .append("\n\n");
            }
        }
        appendHistory(builder, history);
        builder.append("Question: ").append(question).append("\n\n");
        if (included.isEmpty()) {
            builder.append("Tell the user you could not find this information in the documents they can access. ")
                    .append("Suggest rephrasing the question or contacting the relevant department, ")
                    .append("and do not make up an answer. Write the response after \"Final Answer:\".");
        } else {
            builder.append("If the context does not contain the information needed, say that you do not have ")
                    .append("enough information instead of guessing. Cite the source backing each claim as [Source n].");
        }
        return builder.toString();
    }

    private void appendHistory(StringBuilder builder, ConversationContext history) {
        if (history == null || history.isEmpty()) {
            return;
        }
        ConversationContext bounded = ConversationContext.bounded(history.conversationId(), history.turns(),
                properties.getChunkHistoryLimit());
        if (bounded.isEmpty()) {
            return;
        }
        builder.append("Conversation so far:\n");
        for (ConversationTurn turn : bounded.turns()) {
            builder.append(turn.role() == ChatMessageRole.USER ? "User: " : "Assistant: ")
                    .append(abbreviate(turn.content()))
                    .append('\n');
        }
        builder.append('\n');
    }

    private String abbreviate(String content) {
        if (content == null) {
            return "";
        }
        String flat = content.replaceAll("\\s+", " ").strip();
        return flat.length() <= HISTORY_TURN_CHARS ? flat : flat.substring(0, HISTORY_TURN_CHARS - 3) + "...";
    }
}
