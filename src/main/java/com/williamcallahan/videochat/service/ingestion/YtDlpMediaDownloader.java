package com.williamcallahan.videochat.service.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.videochat.config.AppProperties;
import com.williamcallahan.videochat.domain.MediaDownload;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link MediaDownloader} backed by the {@code yt-dlp} executable.
 *
 * <p>Metadata comes from {@code --dump-single-json}; audio is fetched as {@code bestaudio/best} into
 * {@code app.ingestion.download-dir} and named after the video id.</p>
 */
@Component
public class YtDlpMediaDownloader implements MediaDownloader {
    private static final Logger log = LoggerFactory.getLogger(YtDlpMediaDownloader.class);

    private static final List<String> AUDIO_EXTENSIONS = List.of("wav", "m4a", "webm", "mp3", "opus");
    private static final int MAX_ERROR_SNIPPET = 512;

    private final AppProperties.Ingestion ingestionProperties;
    private final ObjectMapper objectMapper;

    public YtDlpMediaDownloader(AppProperties appProperties, ObjectMapper objectMapper) {
        this.ingestionProperties = appProperties.getIngestion();
        this.objectMapper = objectMapper;
    }

    @Override
    public MediaDownload download(String videoUrl, String videoId) {
        Path downloadDir = Path.of(ingestionProperties.getDownloadDir());
        try {
            Files.createDirectories(downloadDir);
        } catch (IOException ioException) {
            throw new MediaDownloadException("Cannot create download directory " + downloadDir, ioException);
        }

        JsonNode metadata = fetchMetadata(videoUrl);
        String title = metadata.path("title").asText(videoId);
        double durationSeconds = metadata.path("duration").asDouble(0.0);

        String outputTemplate = downloadDir.resolve(videoId + ".%(ext)s").toString();
        log.info("[INGEST] Downloading audio for video={} ({}s)", videoId, durationSeconds);
        runYtDlp(List.of("-f", "bestaudio/best", "--no-playlist", "-o", outputTemplate, videoUrl));

        Path audioPath = locateAudioFile(downloadDir, videoId);
        return new MediaDownload(videoId, title, durationSeconds, audioPath);
    }

    private JsonNode fetchMetadata(String videoUrl) {
        String json = runYtDlp(List.of("--dump-single-json", "--no-playlist", "--skip-download", videoUrl));
        try {
            return objectMapper.readTree(json);
        } catch (IOException parseException) {
            throw new MediaDownloadException("Unreadable metadata from yt-dlp for " + videoUrl, parseException);
        }
    }

    private Path locateAudioFile(Path downloadDir, String videoId) {
        for (String extension : AUDIO_EXTENSIONS) {
            Path candidate = downloadDir.resolve(videoId + "." + extension);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        throw new MediaDownloadException("yt-dlp finished but no audio file was found for " + videoId);
    }

    private String runYtDlp(List<String> arguments) {
        List<String> command = new ArrayList<>();
        command.add(ingestionProperties.getYtDlpPath());
        command.addAll(arguments);

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException startException) {
            throw new MediaDownloadException("Cannot start " + ingestionProperties.getYtDlpPath(), startException);
        }

        // drain both pipes so a chatty process cannot block on a full buffer
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));
        try {
            boolean finished = process.waitFor(ingestionProperties.getDownloadTimeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new MediaDownloadException(
                        "yt-dlp timed out after " + ingestionProperties.getDownloadTimeoutSeconds() + "s");
            }
            if (process.exitValue() != 0) {
                throw new MediaDownloadException(
                        "yt-dlp exited with " + process.exitValue() + ": " + snippet(stderr.get()));
            }
            return stdout.get();
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new MediaDownloadException("yt-dlp interrupted", interrupted);
        } catch (ExecutionException readFailure) {
            throw new MediaDownloadException("Failed reading yt-dlp output", readFailure.getCause());
        }
    }

    private static String readFully(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ioException) {
            throw new UncheckedIOException(ioException);
        }
    }

    private static String snippet(String text) {
        String trimmed = text == null ? "" : text.trim();
        return trimmed.length() > MAX_ERROR_SNIPPET ? trimmed.substring(0, MAX_ERROR_SNIPPET) + "..." : trimmed;
    }
}
