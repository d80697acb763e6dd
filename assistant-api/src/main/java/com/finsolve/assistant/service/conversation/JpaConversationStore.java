package com.finsolve.assistant.service.conversation;

import com.finsolve.assistant.model.ChatMessageRole;
import com.finsolve.assistant.model.ConversationStats;
import com.finsolve.assistant.model.ConversationSummary;
import com.finsolve.assistant.model.ConversationTurn;
import com.finsolve.assistant.persistence.entity.ChatTurnEntity;
import com.finsolve.assistant.persistence.entity.ConversationEntity;
import com.finsolve.assistant.persistence.repository.ChatTurnRepository;
import com.finsolve.assistant.persistence.repository.ConversationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Service
@Profile("!inmemory")
@Transactional
public class JpaConversationStore implements ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(JpaConversationStore.class);

    private final ConversationRepository conversationRepository;
    private final ChatTurnRepository chatTurnRepository;

    public JpaConversationStore(ConversationRepository conversationRepository,
                                ChatTurnRepository chatTurnRepository) {
        this.conversationRepository = conversationRepository;
        this.chatTurnRepository = chatTurnRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ConversationSummary> findConversation(String conversationId) {
        return conversationRepository.findById(conversationId).map(this::toSummary);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ConversationTurn> loadHistory(String conversationId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<ChatTurnEntity> newestFirst = new ArrayList<>(
                chatTurnRepository.findByConversationIdOrderBySequenceDesc(conversationId, PageRequest.of(0, limit)));
        Collections.reverse(newestFirst);
        return newestFirst.stream().map(ChatTurnEntity::toTurn).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ConversationTurn> loadTurns(String conversationId) {
        return chatTurnRepository.findByConversationIdOrderBySequenceAsc(conversationId).stream()
                .map(ChatTurnEntity::toTurn)
                .toList();
    }

    @Override
    public void appendTurns(ConversationSummary conversation, List<ConversationTurn> turns) {
        ConversationEntity entity = conversationRepository.findById(conversation.conversationId())
                .orElseGet(() -> conversationRepository.save(new ConversationEntity(
                        conversation.conversationId(),
                        conversation.userId(),
                        conversation.title(),
                        conversation.createdAt())));
        int sequence = chatTurnRepository.findMaxSequence(conversation.conversationId());
        OffsetDateTime latest = null;
        for (ConversationTurn turn : turns) {
            ChatTurnEntity saved = chatTurnRepository.save(ChatTurnEntity.append(entity, turn, ++sequence));
            latest = saved.getCreatedAt();
        }
        entity.touch(latest);
        conversationRepository.save(entity);
        log.debug("Appended {} turns to conversation {}", turns.size(), conversation.conversationId());
    }

    @Override
    @Transactional(readOnly = true)
    public List<ConversationSummary> listConversations(String userId) {
        return conversationRepository.findByUserIdOrderByUpdatedAtDesc(userId).stream()
                .map(this::toSummary)
                .toList();
    }

    @Override
    public Optional<ConversationSummary> renameConversation(String conversationId, String title, OffsetDateTime at) {
        return conversationRepository.findById(conversationId)
                .map(entity -> {
                    entity.rename(title, at);
                    return toSummary(conversationRepository.save(entity));
                });
    }

    @Override
    @Transactional(readOnly = true)
    public ConversationStats statsFor(String userId) {
        return ConversationStats.of(
                chatTurnRepository.countByUserIdAndRole(userId, ChatMessageRole.USER),
                chatTurnRepository.countByUserIdAndRole(userId, ChatMessageRole.ASSISTANT),
                conversationRepository.countByUserId(userId));
    }

    @Override
    public boolean deleteConversation(String conversationId) {
        if (!conversationRepository.existsById(conversationId)) {
            return false;
        }
        int removed = chatTurnRepository.deleteByConversationId(conversationId);
        conversationRepository.deleteById(conversationId);
        log.debug("Deleted conversation {} with {} turns", conversationId, removed);
        return true;
    }

    private ConversationSummary toSummary(ConversationEntity entity) {
        return new ConversationSummary(entity.getConversationId(), entity.getUserId(), entity.getTitle(),
                entity.getCreatedAt(), entity.getUpdatedAt());
    }
}
