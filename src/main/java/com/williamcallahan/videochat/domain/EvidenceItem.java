package com.williamcallahan.videochat.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Objects;

/**
 * One retrieved transcript chunk with the scores that placed it.
 *
 * <p>{@code rawScore} is the score reported by {@code sourceSignal}; {@code normalizedScore} is the
 * fused {@code [0,1]} score. After reranking, {@code rerankScore} holds the cross-encoder score and
 * {@code originalScore} keeps the fused score it replaced in the ordering.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvidenceItem(
        String videoId,
        String videoTitle,
        String videoUrl,
        double startTime,
        double endTime,
        String text,
        String vectorIndexKey,
        double rawScore,
        SourceSignal sourceSignal,
        double normalizedScore,
        Double rerankScore,
        Double originalScore) {

    public EvidenceItem {
        Objects.requireNonNull(vectorIndexKey, "vectorIndexKey");
        Objects.requireNonNull(sourceSignal, "sourceSignal");
    }

    /**
     * Creates an item straight from a search signal, before fusion.
     */
    public static EvidenceItem fromSignal(
            String videoId,
            String videoTitle,
            String videoUrl,
            double startTime,
            double endTime,
            String text,
            String vectorIndexKey,
            double rawScore,
            SourceSignal sourceSignal) {
        return new EvidenceItem(
                videoId, videoTitle, videoUrl, startTime, endTime, text, vectorIndexKey,
                rawScore, sourceSignal, rawScore, null, null);
    }

    public EvidenceItem withNormalizedScore(double score) {
        return new EvidenceItem(
                videoId, videoTitle, videoUrl, startTime, endTime, text, vectorIndexKey,
                rawScore, sourceSignal, score, rerankScore, originalScore);
    }

    public EvidenceItem withRerankScore(double score) {
        return new EvidenceItem(
                videoId, videoTitle, videoUrl, startTime, endTime, text, vectorIndexKey,
                rawScore, sourceSignal, normalizedScore, score, normalizedScore);
    }

    /**
     * Score used for ordering: the rerank score once present, else the fused score.
     */
    public double effectiveScore() {
        return rerankScore != null ? rerankScore : normalizedScore;
    }

    /**
     * Builds the citation a client sees for this item at position {@code index}.
     *
     * @param index one-based evidence number
     * @return citation with the effective score
     */
    public SourceCitation toCitation(int index) {
        return new SourceCitation(
                index, videoId, videoTitle, videoUrl, startTime, endTime, text, effectiveScore());
    }
}
