package com.williamcallahan.videochat.service;

/**
 * Signals that the embedding provider is unavailable or returned an invalid response.
 *
 * <p>Raised during ingestion (which then aborts before any relational write) and during query
 * embedding (which drops the vector signal for that query).</p>
 */
public class EmbeddingServiceUnavailableException extends RuntimeException {

    public EmbeddingServiceUnavailableException(String message) {
        super(message);
    }

    public EmbeddingServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
