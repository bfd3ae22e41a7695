package com.williamcallahan.videochat.service.quiz;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.UUID;

/**
 * Result of grading submitted answers against a stored quiz.
 *
 * @param sessionId graded quiz
 * @param total number of questions
 * @param correct number answered correctly
 * @param score percentage of correct answers, {@code 0..100}
 * @param results per-question outcomes in position order
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QuizGrade(UUID sessionId, int total, int correct, double score, List<QuestionResult> results) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record QuestionResult(
            Long questionId, String submittedAnswer, String correctAnswer, boolean correct, String explanation) {}
}
