package com.williamcallahan.videochat.service.rerank;

import com.williamcallahan.videochat.config.AppProperties;
import com.williamcallahan.videochat.config.CacheConfig;
import com.williamcallahan.videochat.domain.EvidenceItem;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

/**
 * Reorders fused evidence by cross-encoder relevance.
 *
 * <p>A pure re-sort: every candidate keeps its fused score as {@code original_score}, gains a
 * {@code rerank_score}, and nothing is dropped unless {@code topK} truncates.</p>
 */
@Service
public class RerankerService {
    private static final Logger log = LoggerFactory.getLogger(RerankerService.class);

    private static final Comparator<EvidenceItem> BY_RERANK_SCORE_DESC =
            Comparator.comparingDouble(EvidenceItem::effectiveScore).reversed();

    private final CrossEncoderScorer scorer;
    private final AppProperties.Rerank rerankProperties;

    public RerankerService(CrossEncoderScorer scorer, AppProperties appProperties) {
        this.scorer = scorer;
        this.rerankProperties = appProperties.getRerank();
    }

    public boolean isEnabled() {
        return rerankProperties.isEnabled();
    }

    /**
     * Reranks candidates, or passes them through in fused order when reranking is disabled.
     *
     * @param query user query
     * @param candidates fused candidates, best first
     * @param topK maximum items to return, {@code null} for all
     * @return candidates ordered by rerank score
     * @throws RerankingFailureException when the cross-encoder fails
     */
    @Cacheable(
            value = CacheConfig.RERANK_CACHE,
            key = "#query + ':' + #candidates.![vectorIndexKey()] + ':' + #topK",
            condition = "#root.target.enabled")
    public List<EvidenceItem> rerank(String query, List<EvidenceItem> candidates, Integer topK) {
        if (candidates == null || candidates.isEmpty()) {
            return candidates;
        }
        if (!rerankProperties.isEnabled()) {
            return truncate(candidates, topK);
        }

        List<String> passages = candidates.stream().map(EvidenceItem::text).toList();
        List<Double> scores;
        try {
            scores = scorer.score(query, passages);
        } catch (RerankingFailureException failure) {
            throw failure;
        } catch (RuntimeException unexpected) {
            throw new RerankingFailureException("Cross-encoder scoring failed", unexpected);
        }
        if (scores.size() != candidates.size()) {
            throw new RerankingFailureException(
                    "Expected " + candidates.size() + " rerank scores but got " + scores.size());
        }

        List<EvidenceItem> reranked = new ArrayList<>(candidates.size());
        for (int position = 0; position < candidates.size(); position++) {
            reranked.add(candidates.get(position).withRerankScore(scores.get(position)));
        }
        reranked.sort(BY_RERANK_SCORE_DESC);
        log.debug("Reranked {} candidates with {}", reranked.size(), rerankProperties.getModel());
        return truncate(reranked, topK);
    }

    private static List<EvidenceItem> truncate(List<EvidenceItem> items, Integer topK) {
        if (topK == null || topK >= items.size()) {
            return List.copyOf(items);
        }
        return List.copyOf(items.subList(0, Math.max(0, topK)));
    }
}
