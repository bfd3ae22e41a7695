package com.williamcallahan.videochat.service.vector;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Outcome of comparing a video's chunk rows with its vector points.
 *
 * @param videoId reconciled video
 * @param checked chunk rows examined
 * @param missing rows whose key had no point
 * @param repaired missing rows re-embedded and upserted
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReconciliationReport(String videoId, int checked, int missing, int repaired) {}
