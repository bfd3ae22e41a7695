package com.williamcallahan.videochat.service.ingestion;

import com.williamcallahan.videochat.domain.TranscriptSegment;
import java.nio.file.Path;
import java.util.List;

/**
 * Speech-to-text provider port.
 */
public interface TranscriptionClient {

    /**
     * Transcribes an audio file.
     *
     * @param audioFile local audio file
     * @return transcript text with whatever timing the provider reports
     * @throws TranscriptionException when the provider fails
     */
    TranscriptionResult transcribe(Path audioFile);

    /**
     * A provider word with its timing.
     */
    record TimedWord(String word, double start, double end) {}

    /**
     * Raw provider output. {@code words} and {@code segments} are empty for coarse providers.
     */
    record TranscriptionResult(String text, List<TimedWord> words, List<TranscriptSegment> segments) {
        public TranscriptionResult {
            text = text == null ? "" : text;
            words = words == null ? List.of() : List.copyOf(words);
            segments = segments == null ? List.of() : List.copyOf(segments);
        }
    }
}
