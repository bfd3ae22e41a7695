package com.williamcallahan.videochat.support;

import java.util.List;

/**
 * Normalizes base URLs for OpenAI-compatible providers.
 *
 * <p>The SDK and the multipart transcription call both expect the base URL to end with the API
 * version prefix (for example {@code /v1} or Groq's {@code /openai/v1}). Operators often paste a
 * full endpoint URL instead, so known endpoint suffixes are stripped.</p>
 */
public final class OpenAiSdkUrlNormalizer {

    private static final List<String> ENDPOINT_SUFFIXES =
            List.of("/embeddings", "/chat/completions", "/audio/transcriptions");

    private OpenAiSdkUrlNormalizer() {}

    /**
     * Normalizes a base URL.
     *
     * @param baseUrl raw base URL from configuration
     * @return normalized URL ending in a version segment
     * @throws IllegalStateException if baseUrl is null or blank
     */
    public static String normalize(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("OpenAI-compatible base URL is not configured");
        }
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        for (String suffix : ENDPOINT_SUFFIXES) {
            if (trimmed.endsWith(suffix)) {
                trimmed = trimmed.substring(0, trimmed.length() - suffix.length());
                break;
            }
        }
        if (trimmed.matches(".*/v\\d+$")) {
            return trimmed;
        }
        return trimmed + "/v1";
    }
}
