package com.williamcallahan.videochat.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Outcome of a successful video ingestion.
 *
 * @param videoId ingested video identifier
 * @param title video title
 * @param chunkCount number of chunks now stored for the video
 * @param status fixed {@code "success"} marker
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IngestionResult(String videoId, String title, int chunkCount, String status) {

    private static final String STATUS_SUCCESS = "success";

    public static IngestionResult success(String videoId, String title, int chunkCount) {
        return new IngestionResult(videoId, title, chunkCount, STATUS_SUCCESS);
    }
}
