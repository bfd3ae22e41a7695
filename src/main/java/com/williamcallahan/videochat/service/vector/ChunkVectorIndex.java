package com.williamcallahan.videochat.service.vector;

import static io.qdrant.client.ConditionFactory.hasId;
import static io.qdrant.client.ConditionFactory.matchKeyword;
import static io.qdrant.client.ConditionFactory.matchKeywords;
import static io.qdrant.client.PointIdFactory.id;
import static io.qdrant.client.QueryFactory.nearest;
import static io.qdrant.client.ValueFactory.value;
import static io.qdrant.client.VectorsFactory.vectors;

import com.google.common.util.concurrent.ListenableFuture;
import com.williamcallahan.videochat.config.AppProperties;
import com.williamcallahan.videochat.domain.EvidenceItem;
import com.williamcallahan.videochat.domain.SourceSignal;
import com.williamcallahan.videochat.support.RetrySupport;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.grpc.Collections.Distance;
import io.qdrant.client.grpc.Collections.PayloadSchemaType;
import io.qdrant.client.grpc.Collections.VectorParams;
import io.qdrant.client.grpc.JsonWithInt.Value;
import io.qdrant.client.grpc.Points.Filter;
import io.qdrant.client.grpc.Points.PointId;
import io.qdrant.client.grpc.Points.PointStruct;
import io.qdrant.client.grpc.Points.QueryPoints;
import io.qdrant.client.grpc.Points.RetrievedPoint;
import io.qdrant.client.grpc.Points.ScoredPoint;
import io.qdrant.client.grpc.Points.WithPayloadSelector;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Qdrant-backed vector index of transcript chunks.
 *
 * <p>Point ids are the chunks' deterministic vector-index keys, so re-upserting an unchanged video
 * overwrites points in place. Payloads carry a denormalized copy of the chunk row; the relational
 * row stays authoritative.</p>
 */
@Service
public class ChunkVectorIndex {
    private static final Logger log = LoggerFactory.getLogger(ChunkVectorIndex.class);

    static final String PAYLOAD_VIDEO_ID = "video_id";
    static final String PAYLOAD_VIDEO_TITLE = "video_title";
    static final String PAYLOAD_VIDEO_URL = "video_url";
    static final String PAYLOAD_START_TIME = "start_time";
    static final String PAYLOAD_END_TIME = "end_time";
    static final String PAYLOAD_TEXT = "text";

    private static final int UPSERT_BATCH_SIZE = 256;

    private final QdrantClient qdrantClient;
    private final AppProperties.Qdrant qdrantProperties;
    private final AtomicBoolean collectionReady = new AtomicBoolean(false);

    public ChunkVectorIndex(QdrantClient qdrantClient, AppProperties appProperties) {
        this.qdrantClient = Objects.requireNonNull(qdrantClient, "qdrantClient");
        this.qdrantProperties = appProperties.getQdrant();
    }

    /**
     * Creates the collection (cosine distance) when missing and ensures its {@code video_id} keyword index.
     *
     * @param dimensions embedding dimension for a new collection
     */
    public void ensureCollection(int dimensions) {
        if (collectionReady.get()) {
            return;
        }
        String collection = collectionName();
        boolean exists = RetrySupport.executeWithRetry(
                () -> await(qdrantClient.collectionExistsAsync(collection), "collection check"),
                "Qdrant collection check");
        if (!exists) {
            log.info("[QDRANT] Creating collection={} (size={}, distance=Cosine)", collection, dimensions);
            VectorParams vectorParams = VectorParams.newBuilder()
                    .setSize(dimensions)
                    .setDistance(Distance.Cosine)
                    .build();
            await(qdrantClient.createCollectionAsync(collection, vectorParams), "collection create");
        }
        // idempotent on the Qdrant side
        await(
                qdrantClient.createPayloadIndexAsync(
                        collection, PAYLOAD_VIDEO_ID, PayloadSchemaType.Keyword, null, true, null, null),
                "payload index create");
        collectionReady.set(true);
    }

    /**
     * Upserts points in batches.
     *
     * @param points points keyed by their vector-index keys
     */
    public void upsert(List<ChunkPoint> points) {
        if (points == null || points.isEmpty()) {
            return;
        }
        String collection = collectionName();
        for (int from = 0; from < points.size(); from += UPSERT_BATCH_SIZE) {
            List<ChunkPoint> batch = points.subList(from, Math.min(points.size(), from + UPSERT_BATCH_SIZE));
            List<PointStruct> structs = batch.stream().map(ChunkVectorIndex::toPointStruct).toList();
            RetrySupport.executeWithRetry(
                    () -> await(qdrantClient.upsertAsync(collection, structs), "upsert"),
                    "Qdrant upsert");
        }
        log.info("[QDRANT] Upserted {} point(s) into collection={}", points.size(), collection);
    }

    /**
     * Deletes a video's points whose keys are not in {@code keepKeys}.
     *
     * @param videoId video whose stale points should go
     * @param keepKeys keys written by the latest ingestion
     */
    public void deleteStalePoints(String videoId, Collection<String> keepKeys) {
        Filter.Builder filter = Filter.newBuilder().addMust(matchKeyword(PAYLOAD_VIDEO_ID, videoId));
        if (keepKeys != null && !keepKeys.isEmpty()) {
            filter.addMustNot(hasId(toPointIds(keepKeys)));
        }
        Filter staleFilter = filter.build();
        RetrySupport.executeWithRetry(
                () -> await(qdrantClient.deleteAsync(collectionName(), staleFilter), "delete"),
                "Qdrant delete stale points");
    }

    /**
     * Starts a cosine similarity query without blocking.
     *
     * @param queryVector query embedding
     * @param limit maximum hits
     * @param videoIds videos to restrict to, empty for all
     * @return future of vector-signal evidence in descending similarity
     */
    public CompletableFuture<List<EvidenceItem>> searchAsync(float[] queryVector, int limit, Collection<String> videoIds) {
        QueryPoints.Builder request = QueryPoints.newBuilder()
                .setCollectionName(collectionName())
                .setQuery(nearest(queryVector))
                .setWithPayload(WithPayloadSelector.newBuilder().setEnable(true).build())
                .setLimit(limit);
        if (videoIds != null && !videoIds.isEmpty()) {
            request.setFilter(Filter.newBuilder()
                    .addMust(matchKeywords(PAYLOAD_VIDEO_ID, List.copyOf(videoIds)))
                    .build());
        }
        return QdrantFutures.toCompletable(
                        qdrantClient.queryAsync(request.build()), qdrantProperties.getOperationTimeoutSeconds())
                .thenApply(points -> points.stream().map(ChunkVectorIndex::toEvidence).toList());
    }

    /**
     * Returns which of the given keys currently exist as points.
     *
     * @param keys vector-index keys to look up
     * @return subset of {@code keys} present in the collection
     */
    public Set<String> existingKeys(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return Set.of();
        }
        List<RetrievedPoint> found = RetrySupport.executeWithRetry(
                () -> await(
                        qdrantClient.retrieveAsync(collectionName(), toPointIds(keys), false, false, null),
                        "retrieve"),
                "Qdrant retrieve");
        Set<String> present = new LinkedHashSet<>();
        for (RetrievedPoint point : found) {
            present.add(pointIdText(point.getId()));
        }
        return present;
    }

    public String collectionName() {
        return qdrantProperties.getCollection();
    }

    private <T> T await(ListenableFuture<T> future, String operation) {
        return QdrantFutures.await(future, qdrantProperties.getOperationTimeoutSeconds(), operation);
    }

    private static PointStruct toPointStruct(ChunkPoint point) {
        Map<String, Value> payload = new HashMap<>();
        payload.put(PAYLOAD_VIDEO_ID, value(point.videoId()));
        payload.put(PAYLOAD_VIDEO_TITLE, value(Objects.requireNonNullElse(point.videoTitle(), "")));
        payload.put(PAYLOAD_VIDEO_URL, value(Objects.requireNonNullElse(point.videoUrl(), "")));
        payload.put(PAYLOAD_START_TIME, value(point.startTime()));
        payload.put(PAYLOAD_END_TIME, value(point.endTime()));
        payload.put(PAYLOAD_TEXT, value(Objects.requireNonNullElse(point.text(), "")));
        return PointStruct.newBuilder()
                .setId(id(UUID.fromString(point.vectorIndexKey())))
                .setVectors(vectors(point.vector()))
                .putAllPayload(payload)
                .build();
    }

    private static EvidenceItem toEvidence(ScoredPoint point) {
        Map<String, Value> payload = point.getPayloadMap();
        return EvidenceItem.fromSignal(
                payloadString(payload, PAYLOAD_VIDEO_ID),
                payloadString(payload, PAYLOAD_VIDEO_TITLE),
                payloadString(payload, PAYLOAD_VIDEO_URL),
                payloadDouble(payload, PAYLOAD_START_TIME),
                payloadDouble(payload, PAYLOAD_END_TIME),
                payloadString(payload, PAYLOAD_TEXT),
                pointIdText(point.getId()),
                point.getScore(),
                SourceSignal.VECTOR);
    }

    private static List<PointId> toPointIds(Collection<String> keys) {
        List<PointId> pointIds = new ArrayList<>(keys.size());
        for (String key : keys) {
            pointIds.add(id(UUID.fromString(key)));
        }
        return pointIds;
    }

    private static String pointIdText(PointId pointId) {
        if (pointId.hasUuid()) {
            return pointId.getUuid();
        }
        return String.valueOf(pointId.getNum());
    }

    private static String payloadString(Map<String, Value> payload, String key) {
        Value payloadValue = payload.get(key);
        if (payloadValue == null) {
            return "";
        }
        if (payloadValue.getKindCase() == Value.KindCase.STRING_VALUE) {
            return payloadValue.getStringValue();
        }
        return "";
    }

    private static double payloadDouble(Map<String, Value> payload, String key) {
        Value payloadValue = payload.get(key);
        if (payloadValue == null) {
            return 0.0;
        }
        if (payloadValue.getKindCase() == Value.KindCase.DOUBLE_VALUE) {
            return payloadValue.getDoubleValue();
        }
        if (payloadValue.getKindCase() == Value.KindCase.INTEGER_VALUE) {
            return payloadValue.getIntegerValue();
        }
        return 0.0;
    }
}
