package com.williamcallahan.videochat.service;

import com.williamcallahan.videochat.domain.TranscriptChunk;
import com.williamcallahan.videochat.domain.TranscriptSegment;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Splits time-coded transcript segments into overlapping fixed-duration windows.
 *
 * <p>Segments accumulate into the open window until the next segment would push the window span
 * past {@code windowSeconds}. The window is then closed and the next one opens at
 * {@code max(windowStart, windowEnd - overlapSeconds)}, so consecutive windows share roughly
 * {@code overlapSeconds} of time. A segment longer than the window on its own becomes its own chunk.
 * Zero-length segments never form a chunk by themselves; their text is folded into a neighbouring
 * window.
 */
@Component
public class Chunker {

    /**
     * Chunks ordered segments into time windows.
     *
     * @param segments segments ordered by start time
     * @param windowSeconds target window length, positive
     * @param overlapSeconds shared time between consecutive windows, in {@code [0, windowSeconds)}
     * @return chunks in time order, empty when there are no segments
     * @throws IllegalArgumentException when the window or overlap is out of range
     */
    public List<TranscriptChunk> chunk(List<TranscriptSegment> segments, double windowSeconds, double overlapSeconds) {
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("Window length must be positive: " + windowSeconds);
        }
        if (overlapSeconds < 0 || overlapSeconds >= windowSeconds) {
            throw new IllegalArgumentException(
                    "Overlap must be in [0, " + windowSeconds + "): " + overlapSeconds);
        }
        if (segments == null || segments.isEmpty()) {
            return List.of();
        }

        List<TranscriptChunk> chunks = new ArrayList<>();
        List<String> windowTexts = new ArrayList<>();
        double windowStart = segments.get(0).start();
        double windowEnd = windowStart;

        for (TranscriptSegment segment : segments) {
            if (segment.end() - windowStart > windowSeconds) {
                // an instantaneous window has no span of its own; its text joins the next window
                if (windowEnd > windowStart) {
                    chunks.add(new TranscriptChunk(windowStart, windowEnd, String.join(" ", windowTexts)));
                    windowTexts = new ArrayList<>();
                }
                double overlapStart = Math.max(windowStart, windowEnd - overlapSeconds);
                // keep the reopened window within bounds unless the segment alone is oversized
                windowStart = Math.min(segment.start(), Math.max(overlapStart, segment.end() - windowSeconds));
            }
            windowTexts.add(segment.text());
            windowEnd = segment.end();
        }

        if (!windowTexts.isEmpty()) {
            closeLastWindow(chunks, windowStart, windowEnd, String.join(" ", windowTexts));
        }
        return List.copyOf(chunks);
    }

    private static void closeLastWindow(List<TranscriptChunk> chunks, double start, double end, String text) {
        if (end > start) {
            chunks.add(new TranscriptChunk(start, end, text));
        } else if (!chunks.isEmpty()) {
            TranscriptChunk previous = chunks.remove(chunks.size() - 1);
            chunks.add(new TranscriptChunk(
                    previous.startTime(), Math.max(previous.endTime(), end), previous.text() + " " + text));
        } else if (start == 0) {
            // untimed transcript
            chunks.add(new TranscriptChunk(0.0, 0.0, text));
        } else {
            // every segment sits at one instant: widen by the smallest representable step
            chunks.add(new TranscriptChunk(start, Math.nextUp(start), text));
        }
    }
}
