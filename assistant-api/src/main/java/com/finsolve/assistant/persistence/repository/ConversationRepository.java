package com.finsolve.assistant.persistence.repository;

import com.finsolve.assistant.persistence.entity.ConversationEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ConversationRepository extends JpaRepository<ConversationEntity, String> {

    List<ConversationEntity> findByUserIdOrderByUpdatedAtDesc(String userId);

    long countByUserId(String userId);
}
