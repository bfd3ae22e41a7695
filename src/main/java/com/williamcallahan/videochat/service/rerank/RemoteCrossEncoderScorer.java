package com.williamcallahan.videochat.service.rerank;

import com.williamcallahan.videochat.config.AppProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Cross-encoder served over HTTP with a Text Embeddings Inference style {@code /rerank} route.
 *
 * <p>Request {@code {"query": ..., "texts": [...]}}; response {@code [{"index": i, "score": s}, ...]}
 * in any order.</p>
 */
@Component
public class RemoteCrossEncoderScorer implements CrossEncoderScorer {
    private static final Logger log = LoggerFactory.getLogger(RemoteCrossEncoderScorer.class);

    private static final String RERANK_PATH = "/rerank";
    private static final int CONNECT_TIMEOUT_SECONDS = 5;

    private final String baseUrl;
    private final RestTemplate restTemplate;

    public RemoteCrossEncoderScorer(AppProperties appProperties, RestTemplateBuilder restTemplateBuilder) {
        AppProperties.Rerank rerank = appProperties.getRerank();
        this.baseUrl = stripTrailingSlash(rerank.getBaseUrl());
        this.restTemplate = restTemplateBuilder
                .connectTimeout(Duration.ofSeconds(CONNECT_TIMEOUT_SECONDS))
                .readTimeout(Duration.ofSeconds(rerank.getTimeoutSeconds()))
                .build();
    }

    @Override
    public List<Double> score(String query, List<String> passages) {
        if (passages.isEmpty()) {
            return List.of();
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<RerankRequestPayload> request = new HttpEntity<>(new RerankRequestPayload(query, passages), headers);

        RerankScorePayload[] response;
        try {
            response = restTemplate.postForObject(baseUrl + RERANK_PATH, request, RerankScorePayload[].class);
        } catch (RestClientException clientFailure) {
            throw new RerankingFailureException("Cross-encoder request failed: " + clientFailure.getMessage(), clientFailure);
        }
        if (response == null || response.length != passages.size()) {
            throw new RerankingFailureException("Cross-encoder returned "
                    + (response == null ? 0 : response.length) + " score(s) for " + passages.size() + " passage(s)");
        }

        Double[] scores = new Double[passages.size()];
        for (RerankScorePayload entry : response) {
            if (entry.index() < 0 || entry.index() >= scores.length) {
                throw new RerankingFailureException("Cross-encoder returned out-of-range index " + entry.index());
            }
            scores[entry.index()] = entry.score();
        }
        List<Double> aligned = new ArrayList<>(Arrays.asList(scores));
        if (aligned.contains(null)) {
            throw new RerankingFailureException("Cross-encoder response is missing passage scores");
        }
        log.debug("Cross-encoder scored {} passages", aligned.size());
        return aligned;
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url == null ? "" : url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    record RerankRequestPayload(String query, List<String> texts) {}

    record RerankScorePayload(int index, double score) {}
}
