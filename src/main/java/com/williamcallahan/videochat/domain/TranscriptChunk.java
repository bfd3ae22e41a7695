package com.williamcallahan.videochat.domain;

import java.util.Objects;

/**
 * A retrieval-sized window of transcript text produced by the chunker.
 *
 * <p>{@code endTime} is strictly after {@code startTime}, except for the whole-transcript
 * fallback chunk that spans {@code [0, 0]} when the transcription provider returned no timing.
 *
 * @param startTime window start in seconds
 * @param endTime window end in seconds
 * @param text concatenated segment text
 */
public record TranscriptChunk(double startTime, double endTime, String text) {

    public TranscriptChunk {
        Objects.requireNonNull(text, "text");
        boolean untimed = startTime == 0 && endTime == 0;
        if (!untimed && endTime <= startTime) {
            throw new IllegalArgumentException("Chunk end must follow start: [" + startTime + ", " + endTime + "]");
        }
    }

    public double span() {
        return endTime - startTime;
    }
}
