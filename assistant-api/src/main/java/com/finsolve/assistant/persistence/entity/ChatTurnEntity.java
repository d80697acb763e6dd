package com.finsolve.assistant.persistence.entity;

import com.finsolve.assistant.model.ChatMessageRole;
import com.finsolve.assistant.model.ConversationTurn;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

/**
 * One stored message of a conversation. The owning user is denormalized onto the
 * turn so per-user counts need no join.
 */
@Entity
@Table(name = "chat_turns", indexes = {
        @Index(name = "idx_chat_turns_conversation", columnList = "conversation_id, sequence_number"),
        @Index(name = "idx_chat_turns_user_role", columnList = "user_id, role")
})
public class ChatTurnEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "conversation_id", nullable = false, updatable = false, length = 64)
    private String conversationId;

    @Column(name = "user_id", nullable = false, updatable = false, length = 128)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, updatable = false, length = 16)
    private ChatMessageRole role;

    @Column(name = "content", nullable = false, updatable = false, columnDefinition = "text")
    private String content;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private int sequence;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected ChatTurnEntity() {
    }

    private ChatTurnEntity(ConversationEntity conversation, ChatMessageRole role, String content, int sequence,
                           OffsetDateTime createdAt) {
        this.conversationId = conversation.getConversationId();
        this.userId = conversation.getUserId();
        this.role = role;
        this.content = content;
        this.sequence = sequence;
        this.createdAt = createdAt;
    }

    public static ChatTurnEntity append(ConversationEntity conversation, ConversationTurn turn, int sequence) {
        OffsetDateTime createdAt = turn.timestamp() == null ? OffsetDateTime.now() : turn.timestamp();
        return new ChatTurnEntity(conversation, turn.role(), turn.content() == null ? "" : turn.content(),
                sequence, createdAt);
    }

    public ConversationTurn toTurn() {
        return new ConversationTurn(role, content, createdAt);
    }

    public String getConversationId() {
        return conversationId;
    }

    public String getUserId() {
        return userId;
    }

    public ChatMessageRole getRole() {
        return role;
    }

    public int getSequence() {
        return sequence;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
