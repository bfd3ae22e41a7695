package com.williamcallahan.videochat.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.openai.client.OpenAIClient;
import com.openai.core.RequestOptions;
import com.openai.models.embeddings.CreateEmbeddingResponse;
import com.openai.models.embeddings.Embedding;
import com.openai.services.blocking.EmbeddingService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies embedding responses preserve request ordering and are validated against the configured dimension.
 */
class OpenAiCompatibleEmbeddingClientTest {

    private static final String MODEL = "all-MiniLM-L6-v2";

    private OpenAIClient client;
    private EmbeddingService embeddingService;

    @BeforeEach
    void setUp() {
        client = mock(OpenAIClient.class);
        embeddingService = mock(EmbeddingService.class);
        when(client.embeddings()).thenReturn(embeddingService);
    }

    @Test
    void callUsesSdkAndPreservesIndexOrdering() {
        when(embeddingService.create(any(), any(RequestOptions.class))).thenReturn(response(
                embedding(1L, 0.0f, 1.0f),
                embedding(0L, 0.25f, -0.5f)));

        try (OpenAiCompatibleEmbeddingClient clientAdapter = OpenAiCompatibleEmbeddingClient.create(client, MODEL, 2)) {
            List<float[]> vectors = clientAdapter.embed(List.of("a", "b"));

            assertEquals(2, vectors.size());
            assertEquals(0.25f, vectors.get(0)[0]);
            assertEquals(-0.5f, vectors.get(0)[1]);
            assertEquals(0.0f, vectors.get(1)[0]);
            assertEquals(1.0f, vectors.get(1)[1]);
            assertEquals(2, clientAdapter.dimensions());
        }
    }

    @Test
    void throwsWhenEmbeddingDimensionDoesNotMatchConfiguration() {
        when(embeddingService.create(any(), any(RequestOptions.class)))
                .thenReturn(response(embedding(0L, 0.1f, 0.2f, 0.3f)));

        try (OpenAiCompatibleEmbeddingClient clientAdapter = OpenAiCompatibleEmbeddingClient.create(client, MODEL, 2)) {
            EmbeddingServiceUnavailableException thrownException =
                    assertThrows(EmbeddingServiceUnavailableException.class, () -> clientAdapter.embed(List.of("a")));
            assertTrue(thrownException.getMessage().contains("dimension mismatch"));
            verify(embeddingService, times(1)).create(any(), any(RequestOptions.class));
        }
    }

    @Test
    void throwsWhenAnInputHasNoEmbedding() {
        when(embeddingService.create(any(), any(RequestOptions.class)))
                .thenReturn(response(embedding(0L, 0.5f, 0.6f)));

        try (OpenAiCompatibleEmbeddingClient clientAdapter = OpenAiCompatibleEmbeddingClient.create(client, MODEL, 2)) {
            EmbeddingServiceUnavailableException thrownException = assertThrows(
                    EmbeddingServiceUnavailableException.class, () -> clientAdapter.embed(List.of("first", "second")));
            assertTrue(thrownException.getMessage().contains("index 1"));
        }
    }

    @Test
    void emptyInputSkipsTheProvider() {
        try (OpenAiCompatibleEmbeddingClient clientAdapter = OpenAiCompatibleEmbeddingClient.create(client, MODEL, 2)) {
            assertTrue(clientAdapter.embed(List.of()).isEmpty());
            verifyNoInteractions(embeddingService);
        }
    }

    private static CreateEmbeddingResponse response(Embedding... embeddings) {
        return CreateEmbeddingResponse.builder()
                .model(MODEL)
                .usage(CreateEmbeddingResponse.Usage.builder()
                        .promptTokens(1L)
                        .totalTokens(1L)
                        .build())
                .data(List.of(embeddings))
                .build();
    }

    private static Embedding embedding(long index, Float... values) {
        return Embedding.builder()
                .index(index)
                .embedding(List.of(values))
                .build();
    }
}
