package com.williamcallahan.videochat.service.ingestion;

/**
 * Thrown when a URL does not identify a supported video.
 */
public class InvalidMediaReferenceException extends RuntimeException {

    public InvalidMediaReferenceException(String message) {
        super(message);
    }

    public InvalidMediaReferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
