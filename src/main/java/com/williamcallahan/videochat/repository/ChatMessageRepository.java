package com.williamcallahan.videochat.repository;

import com.williamcallahan.videochat.domain.MessageRole;
import com.williamcallahan.videochat.model.ChatMessage;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {
    List<ChatMessage> findBySessionIdOrderByCreatedAtAscIdAsc(UUID sessionId);

    List<ChatMessage> findBySessionIdOrderByCreatedAtDescIdDesc(UUID sessionId, Pageable pageable);

    Optional<ChatMessage> findFirstBySessionIdAndRoleOrderByCreatedAtDescIdDesc(UUID sessionId, MessageRole role);

    @Query("select m.sessionId, count(m) from ChatMessage m where m.sessionId in :sessionIds group by m.sessionId")
    List<Object[]> countBySessionIds(@Param("sessionIds") Collection<UUID> sessionIds);
}
