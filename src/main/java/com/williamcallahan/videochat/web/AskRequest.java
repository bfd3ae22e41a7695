package com.williamcallahan.videochat.web;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.UUID;

/**
 * Request body for a question over the ingested transcripts.
 *
 * @param question the user's question
 * @param videoIds restrict evidence to these videos, all videos when absent
 * @param sessionId existing QA session, a new one is created when absent
 * @param userId session owner for new sessions
 * @param topK evidence items placed in the prompt, the configured default when absent
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AskRequest(
        @NotBlank(message = "question is required") String question,
        List<String> videoIds,
        UUID sessionId,
        String userId,
        @Min(value = 1, message = "top_k must be at least 1") @Max(value = 50, message = "top_k cannot exceed 50")
                Integer topK) {}
