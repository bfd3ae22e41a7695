package com.williamcallahan.videochat.web;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;

/**
 * Request body for a follow-up question in an existing session.
 *
 * @param question the follow-up question
 * @param sessionId session whose recent history frames the question
 * @param videoIds optional evidence restriction
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FollowUpRequest(
        @NotBlank(message = "question is required") String question,
        @NotNull(message = "session_id is required") UUID sessionId,
        List<String> videoIds) {}
