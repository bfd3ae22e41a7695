package com.williamcallahan.videochat.repository;

import com.williamcallahan.videochat.domain.TaskType;
import com.williamcallahan.videochat.model.ChatSession;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ChatSessionRepository extends JpaRepository<ChatSession, UUID> {
    Optional<ChatSession> findFirstByTaskTypeAndTitleOrderByUpdatedAtDesc(TaskType taskType, String title);

    List<ChatSession> findAllByOrderByUpdatedAtDesc(Pageable pageable);

    List<ChatSession> findByUserIdOrderByUpdatedAtDesc(String userId, Pageable pageable);

    List<ChatSession> findByTaskTypeOrderByUpdatedAtDesc(TaskType taskType, Pageable pageable);

    List<ChatSession> findByUserIdAndTaskTypeOrderByUpdatedAtDesc(String userId, TaskType taskType, Pageable pageable);
}
