package com.williamcallahan.videochat.service.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.videochat.config.AppProperties;
import com.williamcallahan.videochat.domain.TranscriptSegment;
import com.williamcallahan.videochat.support.OpenAiSdkUrlNormalizer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Whisper-style transcription over an OpenAI-compatible {@code /audio/transcriptions} endpoint.
 *
 * <p>Requests {@code verbose_json} with word and segment timestamp granularities so the segmenter
 * can rebuild time-coded segments.</p>
 */
@Component
public class OpenAiCompatibleTranscriptionClient implements TranscriptionClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleTranscriptionClient.class);

    private static final String TRANSCRIPTIONS_PATH = "/audio/transcriptions";
    private static final int CONNECT_TIMEOUT_SECONDS = 10;
    private static final int MAX_ERROR_SNIPPET = 512;

    private final AppProperties.Transcription transcriptionProperties;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public OpenAiCompatibleTranscriptionClient(
            AppProperties appProperties, RestTemplateBuilder restTemplateBuilder, ObjectMapper objectMapper) {
        this.transcriptionProperties = appProperties.getTranscription();
        this.objectMapper = objectMapper;
        this.restTemplate = restTemplateBuilder
                .connectTimeout(Duration.ofSeconds(CONNECT_TIMEOUT_SECONDS))
                .readTimeout(Duration.ofSeconds(transcriptionProperties.getTimeoutSeconds()))
                .build();
    }

    @Override
    public TranscriptionResult transcribe(Path audioFile) {
        if (audioFile == null || !Files.isRegularFile(audioFile)) {
            throw new TranscriptionException("Audio file not found: " + audioFile);
        }
        String url = OpenAiSdkUrlNormalizer.normalize(transcriptionProperties.getBaseUrl()) + TRANSCRIPTIONS_PATH;

        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new FileSystemResource(audioFile));
        body.add("model", transcriptionProperties.getModel());
        body.add("response_format", "verbose_json");
        body.add("timestamp_granularities[]", "word");
        body.add("timestamp_granularities[]", "segment");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        String apiKey = transcriptionProperties.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }

        log.info("[INGEST] Transcribing {} with model={}", audioFile.getFileName(), transcriptionProperties.getModel());
        String response;
        try {
            response = restTemplate.postForObject(url, new HttpEntity<>(body, headers), String.class);
        } catch (RestClientResponseException httpFailure) {
            throw new TranscriptionException(
                    "Transcription provider returned HTTP " + httpFailure.getStatusCode().value() + ": "
                            + snippet(httpFailure.getResponseBodyAsString()),
                    httpFailure);
        } catch (RestClientException clientFailure) {
            throw new TranscriptionException("Transcription request failed: " + clientFailure.getMessage(), clientFailure);
        }
        if (response == null || response.isBlank()) {
            throw new TranscriptionException("Transcription provider returned an empty body");
        }
        return parse(response);
    }

    TranscriptionResult parse(String responseJson) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseJson);
        } catch (IOException parseException) {
            throw new TranscriptionException("Unreadable transcription response", parseException);
        }

        List<TimedWord> words = new ArrayList<>();
        for (JsonNode wordNode : root.path("words")) {
            String word = wordNode.path("word").asText("").trim();
            if (word.isEmpty()) {
                continue;
            }
            double start = wordNode.path("start").asDouble(0.0);
            double end = Math.max(start, wordNode.path("end").asDouble(start));
            words.add(new TimedWord(word, start, end));
        }

        List<TranscriptSegment> segments = new ArrayList<>();
        for (JsonNode segmentNode : root.path("segments")) {
            String text = segmentNode.path("text").asText("").trim();
            if (text.isEmpty()) {
                continue;
            }
            double start = Math.max(0.0, segmentNode.path("start").asDouble(0.0));
            double end = Math.max(start, segmentNode.path("end").asDouble(start));
            segments.add(new TranscriptSegment(start, end, text));
        }

        return new TranscriptionResult(root.path("text").asText("").trim(), words, segments);
    }

    private static String snippet(String text) {
        String trimmed = text == null ? "" : text.replace("\r", " ").replace("\n", " ").trim();
        return trimmed.length() > MAX_ERROR_SNIPPET ? trimmed.substring(0, MAX_ERROR_SNIPPET) + "..." : trimmed;
    }
}
