package com.williamcallahan.videochat.service.ingestion;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Derives the vector-index key of a chunk.
 *
 * <p>The key is an RFC 4122 version 5 UUID in the DNS namespace over
 * {@code "{videoId}_{ordinal}_{start}_{end}"}, so identical content always maps to the same point.</p>
 */
@Component
public class ChunkKeyFactory {

    static final UUID NAMESPACE_DNS = UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8");

    public String keyFor(String videoId, int ordinal, double startTime, double endTime) {
        String name = videoId + "_" + ordinal + "_" + startTime + "_" + endTime;
        return nameBasedSha1(NAMESPACE_DNS, name).toString();
    }

    static UUID nameBasedSha1(UUID namespace, String name) {
        MessageDigest sha1;
        try {
            sha1 = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException missingAlgorithm) {
            throw new IllegalStateException("SHA-1 not available", missingAlgorithm);
        }
        ByteBuffer namespaceBytes = ByteBuffer.allocate(16);
        namespaceBytes.putLong(namespace.getMostSignificantBits());
        namespaceBytes.putLong(namespace.getLeastSignificantBits());
        sha1.update(namespaceBytes.array());
        byte[] hash = sha1.digest(name.getBytes(StandardCharsets.UTF_8));

        hash[6] &= 0x0f;
        hash[6] |= 0x50; // version 5
        hash[8] &= 0x3f;
        hash[8] |= (byte) 0x80; // IETF variant

        ByteBuffer uuidBytes = ByteBuffer.wrap(hash, 0, 16);
        return new UUID(uuidBytes.getLong(), uuidBytes.getLong());
    }
}
