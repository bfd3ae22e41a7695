package com.williamcallahan.videochat.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures application caches.
 */
@Configuration
@EnableCaching
public class CacheConfig {
    /** Cache of reranked candidate lists keyed by query and candidate keys. */
    public static final String RERANK_CACHE = "rerank-cache";

    private static final long MAX_ENTRIES = 1_000L;
    private static final Duration EXPIRE_AFTER_WRITE = Duration.ofMinutes(5);

    /**
     * Registers a Caffeine-backed cache manager with bounded, time-expiring entries.
     *
     * @return cache manager
     */
    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager(RERANK_CACHE);
        manager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(MAX_ENTRIES)
                .expireAfterWrite(EXPIRE_AFTER_WRITE));
        return manager;
    }
}
