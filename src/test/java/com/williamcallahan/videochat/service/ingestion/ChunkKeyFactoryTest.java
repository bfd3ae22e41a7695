package com.williamcallahan.videochat.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.util.UUID;
import org.junit.jupiter.api.Test;

/**
 * Verifies deterministic chunk keys.
 */
class ChunkKeyFactoryTest {

    private final ChunkKeyFactory keyFactory = new ChunkKeyFactory();

    @Test
    void matchesRfc4122VersionFiveReferenceValue() {
        UUID key = ChunkKeyFactory.nameBasedSha1(ChunkKeyFactory.NAMESPACE_DNS, "python.org");

        assertEquals("886313e1-3b8a-5372-9b90-0c9aee199e5d", key.toString());
        assertEquals(5, key.version());
    }

    @Test
    void identicalChunkDataYieldsIdenticalKeys() {
        String first = keyFactory.keyFor("dQw4w9WgXcQ", 0, 0.0, 60.0);
        String second = keyFactory.keyFor("dQw4w9WgXcQ", 0, 0.0, 60.0);

        assertEquals(first, second);
    }

    @Test
    void differentOrdinalOrTimingYieldsDifferentKeys() {
        String base = keyFactory.keyFor("dQw4w9WgXcQ", 0, 0.0, 60.0);

        assertNotEquals(base, keyFactory.keyFor("dQw4w9WgXcQ", 1, 0.0, 60.0));
        assertNotEquals(base, keyFactory.keyFor("dQw4w9WgXcQ", 0, 0.0, 61.0));
        assertNotEquals(base, keyFactory.keyFor("otherVideo1", 0, 0.0, 60.0));
    }
}
