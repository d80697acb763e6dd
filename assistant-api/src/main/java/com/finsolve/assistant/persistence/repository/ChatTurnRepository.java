package com.finsolve.assistant.persistence.repository;

import com.finsolve.assistant.model.ChatMessageRole;
import com.finsolve.assistant.persistence.entity.ChatTurnEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ChatTurnRepository extends JpaRepository<ChatTurnEntity, Long> {

    @Query("select coalesce(max(t.sequence), -1) from ChatTurnEntity t where t.conversationId = :conversationId")
    int findMaxSequence(@Param("conversationId") String conversationId);

    List<ChatTurnEntity> findByConversationIdOrderBySequenceAsc(String conversationId);

    List<ChatTurnEntity> findByConversationIdOrderBySequenceDesc(String conversationId, Pageable pageable);

    long countByUserIdAndRole(String userId, ChatMessageRole role);

    @Modifying
    @Query("delete from ChatTurnEntity t where t.conversationId = :conversationId")
    int deleteByConversationId(@Param("conversationId") String conversationId);
}
