package com.williamcallahan.videochat.service.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.williamcallahan.videochat.config.AppProperties;
import com.williamcallahan.videochat.domain.TranscriptSegment;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Writes the segmented transcript of a video as a JSON artifact.
 */
@Component
public class TranscriptArchive {

    private final Path transcriptDir;
    private final ObjectMapper objectMapper;

    public TranscriptArchive(AppProperties appProperties, ObjectMapper objectMapper) {
        this.transcriptDir = Path.of(appProperties.getIngestion().getTranscriptDir());
        this.objectMapper = objectMapper;
    }

    /**
     * Writes {@code {videoId}.json}, replacing any earlier artifact.
     *
     * @return path of the written artifact
     * @throws TranscriptionException when the file cannot be written
     */
    public Path write(String videoId, String title, List<TranscriptSegment> segments) {
        Path target = transcriptDir.resolve(videoId + ".json");
        try {
            Files.createDirectories(transcriptDir);
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(target.toFile(), new TranscriptDocument(videoId, title, segments));
        } catch (IOException ioException) {
            throw new TranscriptionException("Cannot write transcript artifact " + target, ioException);
        }
        return target;
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record TranscriptDocument(String videoId, String title, List<TranscriptSegment> segments) {}
}
