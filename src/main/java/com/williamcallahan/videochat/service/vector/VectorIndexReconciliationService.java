package com.williamcallahan.videochat.service.vector;

import com.williamcallahan.videochat.model.Chunk;
import com.williamcallahan.videochat.model.Video;
import com.williamcallahan.videochat.repository.ChunkRepository;
import com.williamcallahan.videochat.repository.VideoRepository;
import com.williamcallahan.videochat.service.EmbeddingClient;
import com.williamcallahan.videochat.service.VideoNotFoundException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Repairs chunks that were committed to the content store but never reached the vector index.
 */
@Service
public class VectorIndexReconciliationService {
    private static final Logger log = LoggerFactory.getLogger(VectorIndexReconciliationService.class);

    private final VideoRepository videoRepository;
    private final ChunkRepository chunkRepository;
    private final EmbeddingClient embeddingClient;
    private final ChunkVectorIndex vectorIndex;

    public VectorIndexReconciliationService(
            VideoRepository videoRepository,
            ChunkRepository chunkRepository,
            EmbeddingClient embeddingClient,
            ChunkVectorIndex vectorIndex) {
        this.videoRepository = videoRepository;
        this.chunkRepository = chunkRepository;
        this.embeddingClient = embeddingClient;
        this.vectorIndex = vectorIndex;
    }

    /**
     * Re-embeds and upserts every chunk of the video whose key is absent from the index.
     *
     * @param videoId ingested video id
     * @return counts of checked, missing and repaired chunks
     * @throws VideoNotFoundException when the video has not been ingested
     */
    public ReconciliationReport reconcile(String videoId) {
        Video video = videoRepository.findById(videoId)
                .orElseThrow(() -> new VideoNotFoundException("Video not found: " + videoId));
        List<Chunk> chunks = chunkRepository.findByVideoIdOrderByStartTimeAscChunkIndexAsc(videoId);
        if (chunks.isEmpty()) {
            return new ReconciliationReport(videoId, 0, 0, 0);
        }

        vectorIndex.ensureCollection(embeddingClient.dimensions());
        List<String> keys = chunks.stream().map(Chunk::getVectorIndexKey).toList();
        Set<String> present = vectorIndex.existingKeys(keys);

        List<Chunk> missing = new ArrayList<>();
        for (Chunk chunk : chunks) {
            if (!present.contains(chunk.getVectorIndexKey())) {
                log.warn("[INDEX] PartialIndexInconsistency: video={} chunk key={} has no vector point",
                        videoId, chunk.getVectorIndexKey());
                missing.add(chunk);
            }
        }
        if (missing.isEmpty()) {
            log.info("[INDEX] video={} is consistent ({} chunk(s))", videoId, chunks.size());
            return new ReconciliationReport(videoId, chunks.size(), 0, 0);
        }

        List<float[]> vectors = embeddingClient.embed(missing.stream().map(Chunk::getText).toList());
        List<ChunkPoint> points = new ArrayList<>(missing.size());
        for (int position = 0; position < missing.size(); position++) {
            Chunk chunk = missing.get(position);
            points.add(new ChunkPoint(
                    chunk.getVectorIndexKey(),
                    vectors.get(position),
                    videoId,
                    video.getTitle(),
                    video.getSourceUrl(),
                    chunk.getStartTime(),
                    chunk.getEndTime(),
                    chunk.getText()));
        }
        vectorIndex.upsert(points);
        log.info("[INDEX] Repaired {} of {} chunk(s) for video={}", points.size(), chunks.size(), videoId);
        return new ReconciliationReport(videoId, chunks.size(), missing.size(), points.size());
    }
}
