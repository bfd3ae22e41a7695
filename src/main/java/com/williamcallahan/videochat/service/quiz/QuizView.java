package com.williamcallahan.videochat.service.quiz;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.UUID;

/**
 * The questions of one quiz session, in position order.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QuizView(UUID sessionId, List<QuizQuestionView> questions) {

    public QuizView {
        questions = List.copyOf(questions);
    }
}
