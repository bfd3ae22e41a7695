package com.williamcallahan.videochat.service.ingestion;

import com.williamcallahan.videochat.domain.MediaDownload;
import com.williamcallahan.videochat.domain.TranscriptChunk;
import com.williamcallahan.videochat.model.Chunk;
import com.williamcallahan.videochat.model.Video;
import com.williamcallahan.videochat.repository.ChunkRepository;
import com.williamcallahan.videochat.repository.VideoRepository;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Relational half of the ingestion dual-write.
 */
@Service
public class VideoChunkWriter {
    private static final Logger log = LoggerFactory.getLogger(VideoChunkWriter.class);

    private final VideoRepository videoRepository;
    private final ChunkRepository chunkRepository;

    public VideoChunkWriter(VideoRepository videoRepository, ChunkRepository chunkRepository) {
        this.videoRepository = videoRepository;
        this.chunkRepository = chunkRepository;
    }

    /**
     * Upserts the video row and replaces all of its chunks in one transaction.
     *
     * <p>The video row is locked before the chunk replace, so concurrent ingestions of the same video
     * run one after another and the last one to commit owns the chunk set.</p>
     *
     * @param media downloaded media metadata
     * @param sourceUrl canonical video URL
     * @param transcriptPath location of the transcript artifact
     * @param chunks chunks in ordinal order
     * @param vectorIndexKeys distinct keys aligned with {@code chunks}
     * @return the stored chunk rows
     * @throws IllegalArgumentException when the keys do not line up with the chunks
     */
    @Transactional
    public List<Chunk> replaceChunks(
            MediaDownload media,
            String sourceUrl,
            Path transcriptPath,
            List<TranscriptChunk> chunks,
            List<String> vectorIndexKeys) {
        validateKeys(chunks, vectorIndexKeys);

        videoRepository.insertIfAbsent(media.videoId(), media.title(), sourceUrl);
        Video video = videoRepository.findByIdForUpdate(media.videoId())
                .orElseThrow(() -> new IllegalStateException(
                        "Video row missing after upsert, source URL may belong to another video: " + sourceUrl));
        video.setTitle(media.title());
        video.setSourceUrl(sourceUrl);
        video.setDurationSeconds(media.durationSeconds());
        video.setTranscriptPath(transcriptPath == null ? null : transcriptPath.toString());
        videoRepository.save(video);

        int removed = chunkRepository.deleteByVideoId(media.videoId());
        if (removed > 0) {
            log.info("[INGEST] Replacing {} existing chunk(s) for video={}", removed, media.videoId());
        }

        List<Chunk> rows = new ArrayList<>(chunks.size());
        for (int ordinal = 0; ordinal < chunks.size(); ordinal++) {
            TranscriptChunk chunk = chunks.get(ordinal);
            rows.add(new Chunk(
                    media.videoId(),
                    ordinal,
                    chunk.startTime(),
                    chunk.endTime(),
                    chunk.text(),
                    vectorIndexKeys.get(ordinal)));
        }
        return chunkRepository.saveAll(rows);
    }

    private static void validateKeys(List<TranscriptChunk> chunks, List<String> vectorIndexKeys) {
        if (chunks.size() != vectorIndexKeys.size()) {
            throw new IllegalArgumentException(
                    "Chunk/key count mismatch: " + chunks.size() + " vs " + vectorIndexKeys.size());
        }
        Set<String> seen = new HashSet<>();
        for (String key : vectorIndexKeys) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Blank vector index key");
            }
            if (!seen.add(key)) {
                throw new IllegalArgumentException("Duplicate vector index key: " + key);
            }
        }
    }
}
