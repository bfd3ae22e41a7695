package com.williamcallahan.videochat.service.vector;

import static io.qdrant.client.PointIdFactory.id;
import static io.qdrant.client.ValueFactory.value;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.util.concurrent.Futures;
import com.williamcallahan.videochat.config.AppProperties;
import com.williamcallahan.videochat.domain.EvidenceItem;
import com.williamcallahan.videochat.domain.SourceSignal;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.grpc.Collections.CollectionOperationResponse;
import io.qdrant.client.grpc.Collections.PayloadSchemaType;
import io.qdrant.client.grpc.Collections.VectorParams;
import io.qdrant.client.grpc.Points.QueryPoints;
import io.qdrant.client.grpc.Points.RetrievedPoint;
import io.qdrant.client.grpc.Points.ScoredPoint;
import io.qdrant.client.grpc.Points.UpdateResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies collection setup, batched upserts and payload mapping against a stubbed Qdrant client.
 */
class ChunkVectorIndexTest {

    private static final String COLLECTION = "youtubelm_transcripts";

    private QdrantClient qdrantClient;
    private ChunkVectorIndex vectorIndex;

    @BeforeEach
    void setUp() {
        qdrantClient = mock(QdrantClient.class);
        vectorIndex = new ChunkVectorIndex(qdrantClient, new AppProperties());
    }

    @Test
    void createsMissingCollectionWithVideoIdIndexOnce() {
        when(qdrantClient.collectionExistsAsync(COLLECTION)).thenReturn(Futures.immediateFuture(false));
        when(qdrantClient.createCollectionAsync(eq(COLLECTION), any(VectorParams.class)))
                .thenReturn(Futures.immediateFuture(CollectionOperationResponse.getDefaultInstance()));
        when(qdrantClient.createPayloadIndexAsync(
                        eq(COLLECTION), eq("video_id"), eq(PayloadSchemaType.Keyword),
                        isNull(), eq(true), isNull(), isNull()))
                .thenReturn(Futures.immediateFuture(UpdateResult.getDefaultInstance()));

        vectorIndex.ensureCollection(384);
        vectorIndex.ensureCollection(384);

        verify(qdrantClient, times(1)).collectionExistsAsync(COLLECTION);
        verify(qdrantClient).createCollectionAsync(eq(COLLECTION), any(VectorParams.class));
        verify(qdrantClient).createPayloadIndexAsync(
                eq(COLLECTION), eq("video_id"), eq(PayloadSchemaType.Keyword), isNull(), eq(true), isNull(), isNull());
    }

    @Test
    void existingCollectionIsNotRecreated() {
        when(qdrantClient.collectionExistsAsync(COLLECTION)).thenReturn(Futures.immediateFuture(true));
        when(qdrantClient.createPayloadIndexAsync(
                        eq(COLLECTION), eq("video_id"), eq(PayloadSchemaType.Keyword),
                        isNull(), eq(true), isNull(), isNull()))
                .thenReturn(Futures.immediateFuture(UpdateResult.getDefaultInstance()));

        vectorIndex.ensureCollection(384);

        verify(qdrantClient, never()).createCollectionAsync(any(String.class), any(VectorParams.class));
    }

    @Test
    void upsertsInBatches() {
        when(qdrantClient.upsertAsync(eq(COLLECTION), anyList()))
                .thenReturn(Futures.immediateFuture(UpdateResult.getDefaultInstance()));
        List<ChunkPoint> points = new ArrayList<>();
        for (int i = 0; i < 300; i++) {
            points.add(new ChunkPoint(
                    UUID.randomUUID().toString(), new float[] {1f, 0f}, "v1", "Title", "url", i, i + 1, "t" + i));
        }

        vectorIndex.upsert(points);

        verify(qdrantClient, times(2)).upsertAsync(eq(COLLECTION), anyList());
    }

    @Test
    void searchMapsPayloadAndFiltersByVideo() {
        String key = UUID.randomUUID().toString();
        ScoredPoint scoredPoint = ScoredPoint.newBuilder()
                .setId(id(UUID.fromString(key)))
                .setScore(0.87f)
                .putPayload("video_id", value("v1"))
                .putPayload("video_title", value("Recursion 101"))
                .putPayload("video_url", value("https://www.youtube.com/watch?v=v1"))
                .putPayload("start_time", value(12.5))
                .putPayload("end_time", value(72.5))
                .putPayload("text", value("base case first"))
                .build();
        List<QueryPoints> captured = new ArrayList<>();
        doAnswer(invocation -> {
                    captured.add(invocation.getArgument(0));
                    return Futures.immediateFuture(List.of(scoredPoint));
                })
                .when(qdrantClient)
                .queryAsync(any(QueryPoints.class));

        List<EvidenceItem> hits = vectorIndex.searchAsync(new float[] {0.1f}, 5, List.of("v1")).join();

        assertEquals(1, hits.size());
        EvidenceItem hit = hits.get(0);
        assertEquals(key, hit.vectorIndexKey());
        assertEquals("v1", hit.videoId());
        assertEquals("Recursion 101", hit.videoTitle());
        assertEquals(12.5, hit.startTime());
        assertEquals(72.5, hit.endTime());
        assertEquals(SourceSignal.VECTOR, hit.sourceSignal());
        assertEquals(0.87, hit.rawScore(), 1e-6);
        assertEquals(5, captured.get(0).getLimit());
        assertTrue(captured.get(0).hasFilter());
        assertTrue(captured.get(0).getFilter().toString().contains("video_id"));
    }

    @Test
    void searchWithoutVideoIdsHasNoFilter() {
        List<QueryPoints> captured = new ArrayList<>();
        doAnswer(invocation -> {
                    captured.add(invocation.getArgument(0));
                    return Futures.immediateFuture(List.<ScoredPoint>of());
                })
                .when(qdrantClient)
                .queryAsync(any(QueryPoints.class));

        assertTrue(vectorIndex.searchAsync(new float[] {0.1f}, 5, List.of()).join().isEmpty());
        assertFalse(captured.get(0).hasFilter());
    }

    @Test
    void existingKeysReportsRetrievedPoints() {
        String present = UUID.randomUUID().toString();
        String missing = UUID.randomUUID().toString();
        when(qdrantClient.retrieveAsync(eq(COLLECTION), anyList(), eq(false), eq(false), isNull()))
                .thenReturn(Futures.immediateFuture(List.of(
                        RetrievedPoint.newBuilder().setId(id(UUID.fromString(present))).build())));

        Set<String> existing = vectorIndex.existingKeys(List.of(present, missing));

        assertEquals(Set.of(present), existing);
    }
}
