package com.williamcallahan.videochat.service.ingestion;

import com.williamcallahan.videochat.domain.TranscriptSegment;
import com.williamcallahan.videochat.service.ingestion.TranscriptionClient.TimedWord;
import com.williamcallahan.videochat.service.ingestion.TranscriptionClient.TranscriptionResult;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Turns raw provider output into time-coded segments.
 *
 * <p>Word timings win: words are grouped into a new segment whenever the silence between two
 * consecutive words exceeds the gap threshold. Without words the provider's own segments are used.
 * Without any timing the whole text becomes one {@code [0, 0]} segment.</p>
 */
@Component
public class TranscriptSegmenter {

    /**
     * Builds segments from a transcription.
     *
     * @param result provider output
     * @param gapSeconds silence that starts a new segment
     * @return segments in time order, empty only when the transcript has no text at all
     */
    public List<TranscriptSegment> segment(TranscriptionResult result, double gapSeconds) {
        if (!result.words().isEmpty()) {
            return groupWords(result.words(), gapSeconds);
        }
        if (!result.segments().isEmpty()) {
            return result.segments();
        }
        if (result.text().isBlank()) {
            return List.of();
        }
        return List.of(new TranscriptSegment(0.0, 0.0, result.text().trim()));
    }

    private static List<TranscriptSegment> groupWords(List<TimedWord> words, double gapSeconds) {
        List<TranscriptSegment> segments = new ArrayList<>();
        List<TimedWord> current = new ArrayList<>();
        for (TimedWord word : words) {
            if (!current.isEmpty() && word.start() - current.get(current.size() - 1).end() > gapSeconds) {
                segments.add(toSegment(current));
                current = new ArrayList<>();
            }
            current.add(word);
        }
        if (!current.isEmpty()) {
            segments.add(toSegment(current));
        }
        return segments;
    }

    private static TranscriptSegment toSegment(List<TimedWord> words) {
        double start = Math.max(0.0, words.get(0).start());
        double end = Math.max(start, words.get(words.size() - 1).end());
        List<String> tokens = new ArrayList<>(words.size());
        for (TimedWord word : words) {
            tokens.add(word.word().trim());
        }
        return new TranscriptSegment(start, end, String.join(" ", tokens));
    }
}
