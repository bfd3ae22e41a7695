package com.williamcallahan.videochat.config;

import com.williamcallahan.videochat.service.OpenAiCompatibleEmbeddingClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Embedding provider wiring. The sentence-transformer server is reached as an OpenAI-compatible
 * {@code /embeddings} endpoint; there is no runtime fallback to another provider.
 */
@Configuration
public class EmbeddingConfig {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

    @Bean(destroyMethod = "close")
    public OpenAiCompatibleEmbeddingClient embeddingClient(AppProperties appProperties) {
        AppProperties.Embedding embedding = appProperties.getEmbedding();
        log.info("[EMBEDDING] Using OpenAI-compatible provider (model={}, dimensions={})",
                embedding.getModel(), embedding.getDimensions());
        return OpenAiCompatibleEmbeddingClient.create(
                embedding.getBaseUrl(), embedding.getApiKey(), embedding.getModel(), embedding.getDimensions());
    }
}
