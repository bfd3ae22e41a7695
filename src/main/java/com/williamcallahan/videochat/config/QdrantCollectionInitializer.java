package com.williamcallahan.videochat.config;

import com.williamcallahan.videochat.service.EmbeddingClient;
import com.williamcallahan.videochat.service.vector.ChunkVectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Ensures the transcript collection and its {@code video_id} index exist once the app is up.
 */
@Component
@ConditionalOnProperty(name = "app.qdrant.ensure-on-startup", havingValue = "true", matchIfMissing = true)
public class QdrantCollectionInitializer {
    private static final Logger log = LoggerFactory.getLogger(QdrantCollectionInitializer.class);

    private final ChunkVectorIndex vectorIndex;
    private final EmbeddingClient embeddingClient;

    public QdrantCollectionInitializer(ChunkVectorIndex vectorIndex, EmbeddingClient embeddingClient) {
        this.vectorIndex = vectorIndex;
        this.embeddingClient = embeddingClient;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void ensureCollection() {
        try {
            vectorIndex.ensureCollection(embeddingClient.dimensions());
            log.info("[QDRANT] Collection {} ready", vectorIndex.collectionName());
        } catch (RuntimeException e) {
            // ingestion retries this before its first upsert
            log.warn("[QDRANT] Unable to ensure collection {} (will continue): {}",
                    vectorIndex.collectionName(), e.getMessage());
        }
    }
}
