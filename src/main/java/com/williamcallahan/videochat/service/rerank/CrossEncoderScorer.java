package com.williamcallahan.videochat.service.rerank;

import java.util.List;

/**
 * Scores (query, passage) pairs with a cross-encoder.
 */
public interface CrossEncoderScorer {

    /**
     * Scores every passage against the query.
     *
     * @param query user query
     * @param passages candidate passages
     * @return one relevance score per passage, aligned with {@code passages}
     * @throws RerankingFailureException when the model cannot be reached or answers malformed
     */
    List<Double> score(String query, List<String> passages);
}
