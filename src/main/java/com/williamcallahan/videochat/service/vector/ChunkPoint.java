package com.williamcallahan.videochat.service.vector;

import java.util.Objects;

/**
 * One chunk as written to the vector index: deterministic key, embedding and denormalized payload.
 */
public record ChunkPoint(
        String vectorIndexKey,
        float[] vector,
        String videoId,
        String videoTitle,
        String videoUrl,
        double startTime,
        double endTime,
        String text) {

    public ChunkPoint {
        Objects.requireNonNull(vectorIndexKey, "vectorIndexKey");
        Objects.requireNonNull(vector, "vector");
        Objects.requireNonNull(videoId, "videoId");
    }
}
