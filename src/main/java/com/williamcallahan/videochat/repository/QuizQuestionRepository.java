package com.williamcallahan.videochat.repository;

import com.williamcallahan.videochat.model.QuizQuestion;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface QuizQuestionRepository extends JpaRepository<QuizQuestion, Long> {
    List<QuizQuestion> findBySessionIdOrderByPositionAsc(UUID sessionId);
}
