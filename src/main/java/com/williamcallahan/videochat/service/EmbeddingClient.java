package com.williamcallahan.videochat.service;

import java.util.List;

/**
 * Dense text embeddings for transcript chunks and user questions.
 *
 * <p>Implementations return one vector of {@link #dimensions()} floats per input, in input order.
 */
public interface EmbeddingClient {

    /**
     * Embeds a batch of chunk texts.
     *
     * @param texts chunk texts
     * @return vectors aligned with {@code texts}
     * @throws EmbeddingServiceUnavailableException when the provider fails or answers malformed
     */
    List<float[]> embed(List<String> texts);

    /**
     * Embeds a single question for semantic search.
     *
     * @param query question text
     * @return query vector
     * @throws IllegalArgumentException for a blank query
     */
    default float[] embed(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query text is required");
        }
        List<float[]> vectors = embed(List.of(query));
        if (vectors.size() != 1) {
            throw new EmbeddingServiceUnavailableException(
                    "Expected one query embedding but received " + vectors.size());
        }
        return vectors.get(0);
    }

    /** Vector length; sizes the transcript collection. */
    int dimensions();
}
