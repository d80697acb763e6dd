package com.finsolve.assistant.service.conversation;

import com.finsolve.assistant.model.ChatMessageRole;
import com.finsolve.assistant.model.ConversationStats;
import com.finsolve.assistant.model.ConversationSummary;
import com.finsolve.assistant.model.ConversationTurn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
@Profile("inmemory")
public class InMemoryConversationStore implements ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryConversationStore.class);

    private final Map<String, StoredConversation> conversations = new ConcurrentHashMap<>();

    @Override
    public Optional<ConversationSummary> findConversation(String conversationId) {
        return Optional.ofNullable(conversations.get(conversationId)).map(StoredConversation::summary);
    }

    @Override
    public List<ConversationTurn> loadHistory(String conversationId, int limit) {
        List<ConversationTurn> turns = loadTurns(conversationId);
        if (limit <= 0) {
            return List.of();
        }
        return turns.subList(Math.max(0, turns.size() - limit), turns.size());
    }

    @Override
    public List<ConversationTurn> loadTurns(String conversationId) {
        StoredConversation stored = conversations.get(conversationId);
        return stored == null ? List.of() : stored.turns();
    }

    @Override
    public void appendTurns(ConversationSummary conversation, List<ConversationTurn> turns) {
        conversations.compute(conversation.conversationId(), (key, existing) -> {
            ConversationSummary summary = existing == null ? conversation : existing.summary();
            List<ConversationTurn> all = existing == null ? new ArrayList<>() : new ArrayList<>(existing.turns());
            all.addAll(turns);
            OffsetDateTime updatedAt = turns.isEmpty() || turns.get(turns.size() - 1).timestamp() == null
                    ? summary.updatedAt()
                    : turns.get(turns.size() - 1).timestamp();
            ConversationSummary touched = new ConversationSummary(summary.conversationId(), summary.userId(),
                    summary.title(), summary.createdAt(), updatedAt);
            return new StoredConversation(touched, List.copyOf(all));
        });
        log.debug("Appended {} turns to conversation {}", turns.size(), conversation.conversationId());
    }

    @Override
    public List<ConversationSummary> listConversations(String userId) {
        return conversations.values().stream()
                .map(StoredConversation::summary)
                .filter(summary -> summary.userId().equals(userId))
                .sorted(Comparator.comparing(ConversationSummary::updatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    @Override
    public Optional<ConversationSummary> renameConversation(String conversationId, String title, OffsetDateTime at) {
        StoredConversation renamed = conversations.computeIfPresent(conversationId, (key, existing) -> {
            ConversationSummary summary = existing.summary();
            return new StoredConversation(new ConversationSummary(summary.conversationId(), summary.userId(), title,
                    summary.createdAt(), at), existing.turns());
        });
        return Optional.ofNullable(renamed).map(StoredConversation::summary);
    }

    @Override
    public ConversationStats statsFor(String userId) {
        long questions = 0;
        long answers = 0;
        long owned = 0;
        for (StoredConversation stored : conversations.values()) {
            if (!stored.summary().userId().equals(userId)) {
                continue;
            }
            owned++;
            for (ConversationTurn turn : stored.turns()) {
                if (turn.role() == ChatMessageRole.USER) {
                    questions++;
                } else {
                    answers++;
                }
            }
        }
        return ConversationStats.of(questions, answers, owned);
    }

    @Override
    public boolean deleteConversation(String conversationId) {
        return conversations.remove(conversationId) != null;
    }

    private record StoredConversation(ConversationSummary summary, List<ConversationTurn> turns) {}
}
