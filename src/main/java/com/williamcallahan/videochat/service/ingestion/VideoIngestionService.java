package com.williamcallahan.videochat.service.ingestion;

import com.williamcallahan.videochat.config.AppProperties;
import com.williamcallahan.videochat.domain.IngestionResult;
import com.williamcallahan.videochat.domain.MediaDownload;
import com.williamcallahan.videochat.domain.TranscriptChunk;
import com.williamcallahan.videochat.domain.TranscriptSegment;
import com.williamcallahan.videochat.model.Chunk;
import com.williamcallahan.videochat.service.Chunker;
import com.williamcallahan.videochat.service.EmbeddingClient;
import com.williamcallahan.videochat.service.EmbeddingServiceUnavailableException;
import com.williamcallahan.videochat.service.ingestion.TranscriptionClient.TranscriptionResult;
import com.williamcallahan.videochat.service.vector.ChunkPoint;
import com.williamcallahan.videochat.service.vector.ChunkVectorIndex;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Ingests one video: resolve, download, transcribe, chunk, embed, then write both stores.
 *
 * <p>Every step before the relational write may fail and abort the call with the store untouched.
 * The vector upsert runs after the relational commit; its failure is logged as a partial index
 * inconsistency and the ingestion still succeeds, since the chunks stay lexically searchable and
 * can be repaired by reconciliation.</p>
 */
@Service
public class VideoIngestionService {
    private static final Logger log = LoggerFactory.getLogger(VideoIngestionService.class);

    private final MediaReferenceResolver referenceResolver;
    private final MediaDownloader mediaDownloader;
    private final TranscriptionClient transcriptionClient;
    private final TranscriptSegmenter transcriptSegmenter;
    private final TranscriptArchive transcriptArchive;
    private final Chunker chunker;
    private final ChunkKeyFactory chunkKeyFactory;
    private final EmbeddingClient embeddingClient;
    private final VideoChunkWriter chunkWriter;
    private final ChunkVectorIndex vectorIndex;
    private final AppProperties appProperties;

    public VideoIngestionService(
            MediaReferenceResolver referenceResolver,
            MediaDownloader mediaDownloader,
            TranscriptionClient transcriptionClient,
            TranscriptSegmenter transcriptSegmenter,
            TranscriptArchive transcriptArchive,
            Chunker chunker,
            ChunkKeyFactory chunkKeyFactory,
            EmbeddingClient embeddingClient,
            VideoChunkWriter chunkWriter,
            ChunkVectorIndex vectorIndex,
            AppProperties appProperties) {
        this.referenceResolver = referenceResolver;
        this.mediaDownloader = mediaDownloader;
        this.transcriptionClient = transcriptionClient;
        this.transcriptSegmenter = transcriptSegmenter;
        this.transcriptArchive = transcriptArchive;
        this.chunker = chunker;
        this.chunkKeyFactory = chunkKeyFactory;
        this.embeddingClient = embeddingClient;
        this.chunkWriter = chunkWriter;
        this.vectorIndex = vectorIndex;
        this.appProperties = appProperties;
    }

    /**
     * Ingests the video behind {@code videoUrl}, fully replacing any earlier ingestion of it.
     *
     * @param videoUrl watch, short or embed URL
     * @return ingestion outcome with the stored chunk count
     * @throws InvalidMediaReferenceException when the URL is not a supported video reference
     * @throws MediaDownloadException when the media cannot be fetched
     * @throws TranscriptionException when the audio cannot be transcribed
     * @throws EmbeddingServiceUnavailableException when chunk texts cannot be embedded
     */
    public IngestionResult ingest(String videoUrl) {
        String videoId = referenceResolver.resolveVideoId(videoUrl);
        String canonicalUrl = referenceResolver.canonicalUrl(videoId);
        log.info("[INGEST] Starting ingestion for video={}", videoId);

        MediaDownload media = mediaDownloader.download(canonicalUrl, videoId);
        String title = media.title() == null || media.title().isBlank() ? videoId : media.title();
        media = new MediaDownload(videoId, title, media.durationSeconds(), media.audioPath());

        TranscriptionResult transcription;
        try {
            transcription = transcriptionClient.transcribe(media.audioPath());
        } finally {
            deleteAudio(media.audioPath());
        }

        List<TranscriptSegment> segments = transcriptSegmenter.segment(
                transcription, appProperties.getTranscription().getSegmentGapSeconds());
        if (segments.isEmpty()) {
            throw new TranscriptionException("Transcription returned no text for video " + videoId);
        }
        Path transcriptPath = transcriptArchive.write(videoId, title, segments);

        AppProperties.Chunking chunking = appProperties.getChunking();
        List<TranscriptChunk> chunks =
                chunker.chunk(segments, chunking.getWindowSeconds(), chunking.getOverlapSeconds());
        log.info("[INGEST] video={} produced {} segment(s) and {} chunk(s)", videoId, segments.size(), chunks.size());

        List<String> keys = new ArrayList<>(chunks.size());
        List<String> texts = new ArrayList<>(chunks.size());
        for (int ordinal = 0; ordinal < chunks.size(); ordinal++) {
            TranscriptChunk chunk = chunks.get(ordinal);
            keys.add(chunkKeyFactory.keyFor(videoId, ordinal, chunk.startTime(), chunk.endTime()));
            texts.add(chunk.text());
        }

        List<float[]> vectors = embeddingClient.embed(texts);
        if (vectors.size() != texts.size()) {
            throw new EmbeddingServiceUnavailableException(
                    "Embedding count mismatch: expected " + texts.size() + " but got " + vectors.size());
        }

        List<Chunk> stored = chunkWriter.replaceChunks(media, canonicalUrl, transcriptPath, chunks, keys);
        indexChunks(videoId, title, canonicalUrl, stored, vectors);

        log.info("[INGEST] Completed ingestion for video={} with {} chunk(s)", videoId, stored.size());
        return IngestionResult.success(videoId, title, stored.size());
    }

    private void indexChunks(String videoId, String title, String videoUrl, List<Chunk> stored, List<float[]> vectors) {
        List<ChunkPoint> points = new ArrayList<>(stored.size());
        List<String> keys = new ArrayList<>(stored.size());
        for (int position = 0; position < stored.size(); position++) {
            Chunk chunk = stored.get(position);
            keys.add(chunk.getVectorIndexKey());
            points.add(new ChunkPoint(
                    chunk.getVectorIndexKey(),
                    vectors.get(position),
                    videoId,
                    title,
                    videoUrl,
                    chunk.getStartTime(),
                    chunk.getEndTime(),
                    chunk.getText()));
        }
        try {
            vectorIndex.ensureCollection(embeddingClient.dimensions());
            vectorIndex.upsert(points);
            vectorIndex.deleteStalePoints(videoId, keys);
        } catch (RuntimeException indexFailure) {
            log.warn("[INDEX] PartialIndexInconsistency: video={} has {} committed chunk(s) not confirmed in "
                            + "the vector index ({}); run reconciliation to repair",
                    videoId, points.size(), indexFailure.getMessage());
        }
    }

    private static void deleteAudio(Path audioPath) {
        if (audioPath == null) {
            return;
        }
        try {
            Files.deleteIfExists(audioPath);
        } catch (IOException ioException) {
            log.warn("[INGEST] Could not delete downloaded audio {}: {}", audioPath, ioException.getMessage());
        }
    }
}
