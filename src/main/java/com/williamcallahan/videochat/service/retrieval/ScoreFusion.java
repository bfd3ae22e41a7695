package com.williamcallahan.videochat.service.retrieval;

import com.williamcallahan.videochat.domain.EvidenceItem;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fuses vector and lexical hits into one ranked, deduplicated list.
 *
 * <p>Vector hits are inserted first so a chunk found by both signals is attributed to the vector
 * signal. Vector similarity passes through unchanged; lexical rank is divided by a fixed ceiling and
 * clamped to {@code [0, 1]}. The final sort is stable, so ties keep insertion order.</p>
 */
public final class ScoreFusion {

    private static final Comparator<EvidenceItem> BY_NORMALIZED_SCORE_DESC =
            Comparator.comparingDouble(EvidenceItem::normalizedScore).reversed();

    private ScoreFusion() {}

    /**
     * Fuses both signals.
     *
     * @param vectorHits hits from the vector index, best first
     * @param lexicalHits hits from full-text search, best first
     * @param topK maximum items to keep
     * @param lexicalScoreCeiling lexical rank that maps to {@code 1.0}
     * @param videoFilter videos to keep, empty for all
     * @return fused items sorted by normalized score descending
     */
    public static List<EvidenceItem> fuse(
            List<EvidenceItem> vectorHits,
            List<EvidenceItem> lexicalHits,
            int topK,
            double lexicalScoreCeiling,
            Collection<String> videoFilter) {
        if (topK <= 0) {
            return List.of();
        }
        if (lexicalScoreCeiling <= 0) {
            throw new IllegalArgumentException("Lexical score ceiling must be positive: " + lexicalScoreCeiling);
        }
        Set<String> allowedVideos = videoFilter == null ? Set.of() : Set.copyOf(videoFilter);

        Map<String, EvidenceItem> fused = new LinkedHashMap<>();
        for (EvidenceItem hit : nullSafe(vectorHits)) {
            if (allowed(hit, allowedVideos)) {
                fused.putIfAbsent(hit.vectorIndexKey(), hit.withNormalizedScore(hit.rawScore()));
            }
        }
        for (EvidenceItem hit : nullSafe(lexicalHits)) {
            if (allowed(hit, allowedVideos)) {
                fused.putIfAbsent(
                        hit.vectorIndexKey(),
                        hit.withNormalizedScore(normalizeLexicalScore(hit.rawScore(), lexicalScoreCeiling)));
            }
        }

        List<EvidenceItem> ranked = new ArrayList<>(fused.values());
        ranked.sort(BY_NORMALIZED_SCORE_DESC);
        return ranked.size() > topK ? List.copyOf(ranked.subList(0, topK)) : List.copyOf(ranked);
    }

    static double normalizeLexicalScore(double rawScore, double ceiling) {
        if (rawScore <= 0) {
            return 0.0;
        }
        return Math.min(1.0, rawScore / ceiling);
    }

    private static boolean allowed(EvidenceItem hit, Set<String> allowedVideos) {
        return allowedVideos.isEmpty() || allowedVideos.contains(hit.videoId());
    }

    private static List<EvidenceItem> nullSafe(List<EvidenceItem> hits) {
        return hits == null ? List.of() : hits;
    }
}
