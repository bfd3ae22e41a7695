package com.williamcallahan.videochat.service.quiz;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.williamcallahan.videochat.domain.QuestionType;
import com.williamcallahan.videochat.model.QuizQuestion;
import java.util.Map;
import java.util.TreeMap;

/**
 * A stored quiz question as returned to clients. Options are ordered by key.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QuizQuestionView(
        Long id,
        int position,
        String videoId,
        QuestionType questionType,
        String question,
        Map<String, String> options,
        String correctAnswer,
        String explanation) {

    static QuizQuestionView from(QuizQuestion entity) {
        return new QuizQuestionView(
                entity.getId(),
                entity.getPosition(),
                entity.getVideoId(),
                entity.getQuestionType(),
                entity.getQuestion(),
                new TreeMap<>(entity.getOptions()),
                entity.getCorrectAnswer(),
                entity.getExplanation());
    }
}
