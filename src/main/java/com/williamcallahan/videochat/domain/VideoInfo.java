package com.williamcallahan.videochat.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Subject description sent in summary metadata, cached and done events.
 *
 * @param videoId video identifier
 * @param title video title
 * @param videoUrl canonical watch URL
 * @param duration covered transcript length as {@code MM:SS}
 * @param durationSeconds covered transcript length in whole seconds
 * @param numChunks number of chunks the summary was built from
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record VideoInfo(
        String videoId, String title, String videoUrl, String duration, long durationSeconds, int numChunks) {}
