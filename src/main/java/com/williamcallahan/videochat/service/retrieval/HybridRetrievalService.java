package com.williamcallahan.videochat.service.retrieval;

import com.williamcallahan.videochat.config.AppProperties;
import com.williamcallahan.videochat.domain.EvidenceItem;
import com.williamcallahan.videochat.domain.SourceSignal;
import com.williamcallahan.videochat.model.Chunk;
import com.williamcallahan.videochat.repository.ChunkFullTextSearchRepository;
import com.williamcallahan.videochat.repository.ChunkRepository;
import com.williamcallahan.videochat.service.EmbeddingClient;
import com.williamcallahan.videochat.service.vector.ChunkVectorIndex;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Hybrid lexical + vector retrieval over transcript chunks.
 *
 * <p>Both signals run concurrently on the retrieval executor. A failed signal is logged as a
 * {@link RetrievalNotice} and contributes nothing; the other signal is still fused.</p>
 */
@Service
public class HybridRetrievalService {
    private static final Logger log = LoggerFactory.getLogger(HybridRetrievalService.class);

    private final ChunkFullTextSearchRepository fullTextSearch;
    private final ChunkVectorIndex vectorIndex;
    private final EmbeddingClient embeddingClient;
    private final ChunkRepository chunkRepository;
    private final AppProperties.Retrieval retrievalProperties;
    private final Executor retrievalExecutor;

    public HybridRetrievalService(
            ChunkFullTextSearchRepository fullTextSearch,
            ChunkVectorIndex vectorIndex,
            EmbeddingClient embeddingClient,
            ChunkRepository chunkRepository,
            AppProperties appProperties,
            @Qualifier("retrievalExecutor") Executor retrievalExecutor) {
        this.fullTextSearch = fullTextSearch;
        this.vectorIndex = vectorIndex;
        this.embeddingClient = embeddingClient;
        this.chunkRepository = chunkRepository;
        this.retrievalProperties = appProperties.getRetrieval();
        this.retrievalExecutor = retrievalExecutor;
    }

    /**
     * Retrieves with the configured {@code top_k}, lexical and vector depths.
     */
    public List<EvidenceItem> retrieve(String query, Collection<String> videoIds) {
        return retrieve(
                query,
                retrievalProperties.getTopK(),
                retrievalProperties.getLexicalK(),
                retrievalProperties.getVectorK(),
                videoIds);
    }

    /**
     * Runs both signals and fuses them.
     *
     * @param query user query
     * @param topK maximum fused items
     * @param lexicalK lexical hits to request
     * @param vectorK vector hits to request
     * @param videoIds videos to restrict to, empty or null for all
     * @return fused evidence, best first; empty when neither signal found anything
     */
    public List<EvidenceItem> retrieve(
            String query, int topK, int lexicalK, int vectorK, Collection<String> videoIds) {
        Objects.requireNonNull(query, "query");
        List<String> filter = videoIds == null ? List.of() : List.copyOf(videoIds);

        CompletableFuture<List<EvidenceItem>> lexicalFuture =
                CompletableFuture.supplyAsync(() -> fullTextSearch.search(query, lexicalK, filter), retrievalExecutor);
        CompletableFuture<List<EvidenceItem>> vectorFuture = CompletableFuture
                .supplyAsync(() -> embeddingClient.embed(query), retrievalExecutor)
                .thenCompose(queryVector -> vectorIndex.searchAsync(queryVector, vectorK, filter));

        List<EvidenceItem> vectorHits = collect(vectorFuture, SourceSignal.VECTOR);
        List<EvidenceItem> lexicalHits = collect(lexicalFuture, SourceSignal.LEXICAL);

        List<EvidenceItem> fused = ScoreFusion.fuse(
                vectorHits, lexicalHits, topK, retrievalProperties.getLexicalScoreCeiling(), filter);
        log.info("[RETRIEVAL] vector={} lexical={} fused={} (topK={}, videos={})",
                vectorHits.size(), lexicalHits.size(), fused.size(), topK, filter.isEmpty() ? "all" : filter);
        return fused;
    }

    /**
     * Loads a video's chunks in time order.
     *
     * @param videoId video id
     * @param limit maximum chunks, non-positive for all
     * @return chunks ordered by start time
     */
    public List<Chunk> chunksForVideo(String videoId, int limit) {
        if (limit <= 0) {
            return chunkRepository.findByVideoIdOrderByStartTimeAscChunkIndexAsc(videoId);
        }
        return chunkRepository.findByVideoIdOrderByStartTimeAscChunkIndexAsc(videoId, PageRequest.of(0, limit));
    }

    private List<EvidenceItem> collect(CompletableFuture<List<EvidenceItem>> signalFuture, SourceSignal signal) {
        try {
            return signalFuture.get(retrievalProperties.getTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            signalFuture.cancel(true);
            throw new IllegalStateException("Retrieval interrupted", interrupted);
        } catch (ExecutionException executionException) {
            Throwable cause = executionException.getCause() == null ? executionException : executionException.getCause();
            logNotice(RetrievalNotice.of(signal, cause));
        } catch (TimeoutException timeoutException) {
            signalFuture.cancel(true);
            logNotice(RetrievalNotice.of(signal, timeoutException));
        }
        return List.of();
    }

    private static void logNotice(RetrievalNotice notice) {
        log.warn("[RETRIEVAL] {} signal unavailable ({}): {}",
                notice.signal().wireValue(), notice.errorType(), notice.detail());
    }
}
