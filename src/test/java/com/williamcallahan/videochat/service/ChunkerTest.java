package com.williamcallahan.videochat.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.videochat.domain.TranscriptChunk;
import com.williamcallahan.videochat.domain.TranscriptSegment;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies time-window chunking of transcript segments.
 */
class ChunkerTest {

    private final Chunker chunker = new Chunker();

    @Test
    void threeThirtySecondSegmentsProduceTwoOverlappingChunks() {
        List<TranscriptSegment> segments = List.of(
                new TranscriptSegment(0, 30, "first"),
                new TranscriptSegment(30, 60, "second"),
                new TranscriptSegment(60, 90, "third"));

        List<TranscriptChunk> chunks = chunker.chunk(segments, 60, 10);

        assertEquals(2, chunks.size());
        assertEquals(0.0, chunks.get(0).startTime());
        assertEquals(60.0, chunks.get(0).endTime());
        assertEquals("first second", chunks.get(0).text());
        assertTrue(chunks.get(1).startTime() >= 50.0, "second chunk should start within the overlap");
        assertEquals(90.0, chunks.get(1).endTime());
        assertEquals("third", chunks.get(1).text());
    }

    @Test
    void chunkSpansStayWithinWindowForShortSegments() {
        List<TranscriptSegment> segments = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            segments.add(new TranscriptSegment(i * 7.0, i * 7.0 + 7.0, "segment " + i));
        }

        List<TranscriptChunk> chunks = chunker.chunk(segments, 60, 10);

        assertTrue(chunks.size() > 1);
        for (TranscriptChunk chunk : chunks) {
            assertTrue(chunk.span() <= 60.0, "span " + chunk.span() + " exceeds window");
        }
        for (int i = 1; i < chunks.size(); i++) {
            double overlap = chunks.get(i - 1).endTime() - chunks.get(i).startTime();
            assertTrue(overlap >= 0 && overlap <= 10.0, "overlap " + overlap + " out of range");
        }
    }

    @Test
    void oversizedSegmentBecomesItsOwnChunk() {
        List<TranscriptSegment> segments = List.of(
                new TranscriptSegment(0, 10, "intro"),
                new TranscriptSegment(10, 200, "monologue"));

        List<TranscriptChunk> chunks = chunker.chunk(segments, 60, 10);

        assertEquals(2, chunks.size());
        assertEquals(10.0, chunks.get(1).startTime());
        assertEquals(200.0, chunks.get(1).endTime());
        assertEquals("monologue", chunks.get(1).text());
    }

    @Test
    void zeroLengthLeadingSegmentJoinsOverflowingSegment() {
        List<TranscriptSegment> segments = List.of(
                new TranscriptSegment(10, 10, "uh"),
                new TranscriptSegment(10, 80, "long talk"));

        List<TranscriptChunk> chunks = chunker.chunk(segments, 60, 10);

        assertEquals(1, chunks.size());
        assertEquals(10.0, chunks.get(0).startTime());
        assertEquals(80.0, chunks.get(0).endTime());
        assertEquals("uh long talk", chunks.get(0).text());
    }

    @Test
    void loneZeroLengthSegmentKeepsItsText() {
        List<TranscriptChunk> chunks = chunker.chunk(List.of(new TranscriptSegment(5, 5, "hi")), 60, 10);

        assertEquals(1, chunks.size());
        assertEquals(5.0, chunks.get(0).startTime());
        assertTrue(chunks.get(0).endTime() > 5.0);
        assertEquals("hi", chunks.get(0).text());
    }

    @Test
    void zeroLengthSegmentsAtOneInstantShareAChunk() {
        List<TranscriptSegment> segments = List.of(
                new TranscriptSegment(42, 42, "a"),
                new TranscriptSegment(42, 42, "b"));

        List<TranscriptChunk> chunks = chunker.chunk(segments, 60, 10);

        assertEquals(1, chunks.size());
        assertEquals("a b", chunks.get(0).text());
    }

    @Test
    void untimedTranscriptStaysOneZeroSpanChunk() {
        List<TranscriptChunk> chunks = chunker.chunk(List.of(new TranscriptSegment(0, 0, "whole text")), 60, 10);

        assertEquals(1, chunks.size());
        assertEquals(0.0, chunks.get(0).startTime());
        assertEquals(0.0, chunks.get(0).endTime());
        assertEquals("whole text", chunks.get(0).text());
    }

    @Test
    void emptyInputYieldsNoChunks() {
        assertTrue(chunker.chunk(List.of(), 60, 10).isEmpty());
    }

    @Test
    void rejectsOverlapNotSmallerThanWindow() {
        List<TranscriptSegment> segments = List.of(new TranscriptSegment(0, 5, "x"));

        assertThrows(IllegalArgumentException.class, () -> chunker.chunk(segments, 60, 60));
        assertThrows(IllegalArgumentException.class, () -> chunker.chunk(segments, 0, 0));
    }
}
