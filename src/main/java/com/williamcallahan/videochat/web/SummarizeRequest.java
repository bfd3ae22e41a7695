package com.williamcallahan.videochat.web;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.williamcallahan.videochat.service.summary.SummaryType;
import jakarta.validation.constraints.NotBlank;
import java.util.UUID;

/**
 * Request body for a video summary.
 *
 * @param videoId ingested video to summarize
 * @param summaryType {@code quick} or {@code detailed}, detailed when absent
 * @param sessionId existing summary session, or null
 * @param forceRegenerate ignore a stored summary
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SummarizeRequest(
        @NotBlank(message = "video_id is required") String videoId,
        SummaryType summaryType,
        UUID sessionId,
        boolean forceRegenerate) {

    public SummaryType resolvedSummaryType() {
        return summaryType == null ? SummaryType.DETAILED : summaryType;
    }
}
