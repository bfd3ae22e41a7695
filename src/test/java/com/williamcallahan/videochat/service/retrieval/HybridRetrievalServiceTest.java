package com.williamcallahan.videochat.service.retrieval;

import static com.williamcallahan.videochat.service.retrieval.ScoreFusionTest.hit;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.videochat.config.AppProperties;
import com.williamcallahan.videochat.domain.EvidenceItem;
import com.williamcallahan.videochat.domain.SourceSignal;
import com.williamcallahan.videochat.repository.ChunkFullTextSearchRepository;
import com.williamcallahan.videochat.repository.ChunkRepository;
import com.williamcallahan.videochat.service.EmbeddingClient;
import com.williamcallahan.videochat.service.EmbeddingServiceUnavailableException;
import com.williamcallahan.videochat.service.vector.ChunkVectorIndex;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Pageable;

/**
 * Verifies that hybrid retrieval fuses both signals and tolerates a failed signal.
 */
class HybridRetrievalServiceTest {

    private ChunkFullTextSearchRepository fullTextSearch;
    private ChunkVectorIndex vectorIndex;
    private EmbeddingClient embeddingClient;
    private ChunkRepository chunkRepository;
    private HybridRetrievalService retrievalService;

    @BeforeEach
    void setUp() {
        fullTextSearch = mock(ChunkFullTextSearchRepository.class);
        vectorIndex = mock(ChunkVectorIndex.class);
        embeddingClient = mock(EmbeddingClient.class);
        chunkRepository = mock(ChunkRepository.class);
        retrievalService = new HybridRetrievalService(
                fullTextSearch, vectorIndex, embeddingClient, chunkRepository, new AppProperties(), Runnable::run);
    }

    @Test
    void fusesVectorAndLexicalHits() {
        float[] queryVector = {0.1f, 0.2f, 0.3f};
        when(embeddingClient.embed("what is recursion")).thenReturn(queryVector);
        when(vectorIndex.searchAsync(eq(queryVector), eq(20), anyCollection()))
                .thenReturn(CompletableFuture.completedFuture(List.of(hit("k1", "v1", 0.6, SourceSignal.VECTOR))));
        when(fullTextSearch.search(eq("what is recursion"), eq(20), anyCollection()))
                .thenReturn(List.of(
                        hit("k1", "v1", 8.0, SourceSignal.LEXICAL),
                        hit("k2", "v1", 9.0, SourceSignal.LEXICAL)));

        List<EvidenceItem> evidence = retrievalService.retrieve("what is recursion", null);

        assertEquals(List.of("k2", "k1"), evidence.stream().map(EvidenceItem::vectorIndexKey).toList());
        assertEquals(SourceSignal.VECTOR, evidence.get(1).sourceSignal());
    }

    @Test
    void embeddingFailureStillReturnsLexicalHits() {
        when(embeddingClient.embed("loops")).thenThrow(new EmbeddingServiceUnavailableException("down"));
        when(fullTextSearch.search(eq("loops"), anyInt(), anyCollection()))
                .thenReturn(List.of(hit("k3", "v2", 2.0, SourceSignal.LEXICAL)));

        List<EvidenceItem> evidence = retrievalService.retrieve("loops", List.of("v2"));

        assertEquals(1, evidence.size());
        assertEquals(0.2, evidence.get(0).normalizedScore(), 1e-9);
    }

    @Test
    void noHitsFromEitherSignalYieldsEmptyList() {
        when(embeddingClient.embed("nothing")).thenReturn(new float[] {1f});
        when(vectorIndex.searchAsync(any(), anyInt(), anyCollection()))
                .thenReturn(CompletableFuture.completedFuture(List.of()));
        when(fullTextSearch.search(eq("nothing"), anyInt(), anyCollection())).thenReturn(List.of());

        assertTrue(retrievalService.retrieve("nothing", List.of()).isEmpty());
    }

    @Test
    void failedVectorSearchFutureDoesNotAbortFusion() {
        when(embeddingClient.embed("streams")).thenReturn(new float[] {1f});
        when(vectorIndex.searchAsync(any(), anyInt(), anyCollection()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("qdrant unavailable")));
        when(fullTextSearch.search(eq("streams"), anyInt(), anyCollection()))
                .thenReturn(List.of(hit("k9", "v1", 20.0, SourceSignal.LEXICAL)));

        List<EvidenceItem> evidence = retrievalService.retrieve("streams", null);

        assertEquals(1, evidence.size());
        assertEquals(1.0, evidence.get(0).normalizedScore(), 1e-9);
    }

    @Test
    void chunksForVideoPagesWhenLimited() {
        retrievalService.chunksForVideo("v1", 5);
        verify(chunkRepository).findByVideoIdOrderByStartTimeAscChunkIndexAsc(eq("v1"), any(Pageable.class));

        retrievalService.chunksForVideo("v1", 0);
        verify(chunkRepository).findByVideoIdOrderByStartTimeAscChunkIndexAsc("v1");
    }
}
