package com.williamcallahan.videochat.web;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.williamcallahan.videochat.domain.QuestionType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import java.util.UUID;

/**
 * Request body for quiz generation. The upper bound on {@code num_questions} is configured.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GenerateQuizRequest(
        @NotEmpty(message = "video_ids must contain at least one video") List<String> videoIds,
        @Min(value = 1, message = "num_questions must be at least 1") int numQuestions,
        QuestionType questionType,
        UUID sessionId) {}
