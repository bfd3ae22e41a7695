package com.williamcallahan.videochat.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Verifies OpenAI-compatible base URL normalization stays deterministic across formats.
 */
class OpenAiSdkUrlNormalizerTest {

    @ParameterizedTest(name = "normalize(\"{0}\") = \"{1}\"")
    @CsvSource({
        "https://api.openai.com/v1, https://api.openai.com/v1",
        "https://api.openai.com/v1/, https://api.openai.com/v1",
        "https://api.groq.com/openai/v1, https://api.groq.com/openai/v1",
        "https://api.groq.com/openai/v1/audio/transcriptions, https://api.groq.com/openai/v1",
        "https://example.com/v1/embeddings, https://example.com/v1",
        "https://example.com/v1/chat/completions, https://example.com/v1",
        "https://example.com, https://example.com/v1"
    })
    void normalizeHandlesVariousFormats(String input, String expected) {
        assertEquals(expected, OpenAiSdkUrlNormalizer.normalize(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"  https://api.openai.com/v1  "})
    void normalizeTrimsWhitespace(String input) {
        assertEquals("https://api.openai.com/v1", OpenAiSdkUrlNormalizer.normalize(input));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    void normalizeThrowsOnNullOrBlank(String input) {
        IllegalStateException ex =
                assertThrows(IllegalStateException.class, () -> OpenAiSdkUrlNormalizer.normalize(input));
        assertEquals("OpenAI-compatible base URL is not configured", ex.getMessage());
    }
}
