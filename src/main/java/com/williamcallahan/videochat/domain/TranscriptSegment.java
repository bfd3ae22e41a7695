package com.williamcallahan.videochat.domain;

import java.util.Objects;

/**
 * One time-coded span of transcribed speech.
 *
 * @param start start offset in seconds
 * @param end end offset in seconds, never before {@code start}
 * @param text spoken text for the span
 */
public record TranscriptSegment(double start, double end, String text) {

    public TranscriptSegment {
        Objects.requireNonNull(text, "text");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid segment range [" + start + ", " + end + "]");
        }
    }

    public double duration() {
        return end - start;
    }
}
