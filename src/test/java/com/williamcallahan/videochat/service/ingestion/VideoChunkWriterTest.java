package com.williamcallahan.videochat.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.williamcallahan.videochat.domain.MediaDownload;
import com.williamcallahan.videochat.domain.TranscriptChunk;
import com.williamcallahan.videochat.model.Chunk;
import com.williamcallahan.videochat.model.Video;
import com.williamcallahan.videochat.repository.ChunkRepository;
import com.williamcallahan.videochat.repository.VideoRepository;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.InOrder;

/**
 * Verifies the locked video upsert and the delete-then-insert chunk replacement.
 */
class VideoChunkWriterTest {

    private static final String VIDEO_ID = "dQw4w9WgXcQ";
    private static final String VIDEO_URL = "https://www.youtube.com/watch?v=" + VIDEO_ID;
    private static final MediaDownload MEDIA =
            new MediaDownload(VIDEO_ID, "Recursion explained", 125.0, Path.of("/tmp/audio.mp3"));
    private static final Path TRANSCRIPT = Path.of("/data/transcripts/" + VIDEO_ID + ".json");

    private VideoRepository videoRepository;
    private ChunkRepository chunkRepository;
    private Video video;
    private List<Chunk> storedChunks;
    private VideoChunkWriter writer;

    @BeforeEach
    void setUp() {
        videoRepository = mock(VideoRepository.class);
        chunkRepository = mock(ChunkRepository.class);
        video = new Video(VIDEO_ID, VIDEO_URL);
        storedChunks = new ArrayList<>();

        when(videoRepository.findByIdForUpdate(VIDEO_ID)).thenReturn(Optional.of(video));
        when(chunkRepository.deleteByVideoId(VIDEO_ID)).thenAnswer(invocation -> {
            int removed = storedChunks.size();
            storedChunks.clear();
            return removed;
        });
        when(chunkRepository.saveAll(ArgumentMatchers.<Chunk>anyList())).thenAnswer(invocation -> {
            List<Chunk> rows = invocation.getArgument(0);
            storedChunks.addAll(rows);
            return rows;
        });

        writer = new VideoChunkWriter(videoRepository, chunkRepository);
    }

    @Test
    void locksVideoBeforeReplacingChunks() {
        List<TranscriptChunk> chunks = List.of(
                new TranscriptChunk(0, 60, "Recursion needs a base case."),
                new TranscriptChunk(50, 110, "Each call adds a stack frame."));

        List<Chunk> rows = writer.replaceChunks(MEDIA, VIDEO_URL, TRANSCRIPT, chunks, List.of("key-0", "key-1"));

        InOrder order = inOrder(videoRepository, chunkRepository);
        order.verify(videoRepository).insertIfAbsent(VIDEO_ID, "Recursion explained", VIDEO_URL);
        order.verify(videoRepository).findByIdForUpdate(VIDEO_ID);
        order.verify(videoRepository).save(video);
        order.verify(chunkRepository).deleteByVideoId(VIDEO_ID);
        order.verify(chunkRepository).saveAll(anyList());

        assertEquals(2, rows.size());
        assertEquals(0, rows.get(0).getChunkIndex());
        assertEquals("key-0", rows.get(0).getVectorIndexKey());
        assertEquals(1, rows.get(1).getChunkIndex());
        assertEquals("key-1", rows.get(1).getVectorIndexKey());
        assertEquals(50.0, rows.get(1).getStartTime());
        assertEquals(110.0, rows.get(1).getEndTime());
        assertEquals("Recursion explained", video.getTitle());
        assertEquals(125.0, video.getDurationSeconds().doubleValue());
        assertEquals(TRANSCRIPT.toString(), video.getTranscriptPath());
    }

    @Test
    void reingestionKeepsOnlyLatestChunkSet() {
        writer.replaceChunks(MEDIA, VIDEO_URL, TRANSCRIPT,
                List.of(
                        new TranscriptChunk(0, 60, "a"),
                        new TranscriptChunk(50, 110, "b"),
                        new TranscriptChunk(100, 125, "c")),
                List.of("old-0", "old-1", "old-2"));

        writer.replaceChunks(MEDIA, VIDEO_URL, TRANSCRIPT,
                List.of(new TranscriptChunk(0, 70, "a b"), new TranscriptChunk(60, 125, "c")),
                List.of("new-0", "new-1"));

        assertEquals(2, storedChunks.size());
        assertEquals(List.of("new-0", "new-1"),
                storedChunks.stream().map(Chunk::getVectorIndexKey).collect(Collectors.toList()));
    }

    @Test
    void countMismatchLeavesRepositoriesUntouched() {
        List<TranscriptChunk> chunks = List.of(new TranscriptChunk(0, 60, "only"));

        assertThrows(IllegalArgumentException.class,
                () -> writer.replaceChunks(MEDIA, VIDEO_URL, TRANSCRIPT, chunks, List.of("key-0", "key-1")));

        verifyNoInteractions(videoRepository, chunkRepository);
    }

    @Test
    void duplicateKeysLeaveRepositoriesUntouched() {
        List<TranscriptChunk> chunks = List.of(new TranscriptChunk(0, 60, "a"), new TranscriptChunk(50, 110, "b"));

        assertThrows(IllegalArgumentException.class,
                () -> writer.replaceChunks(MEDIA, VIDEO_URL, TRANSCRIPT, chunks, List.of("key-0", "key-0")));

        verifyNoInteractions(videoRepository, chunkRepository);
    }

    @Test
    void missingRowAfterUpsertAbortsBeforeChunkWrites() {
        when(videoRepository.findByIdForUpdate(VIDEO_ID)).thenReturn(Optional.empty());

        assertThrows(IllegalStateException.class, () -> writer.replaceChunks(
                MEDIA, VIDEO_URL, TRANSCRIPT, List.of(new TranscriptChunk(0, 60, "a")), List.of("key-0")));

        verifyNoInteractions(chunkRepository);
    }
}
