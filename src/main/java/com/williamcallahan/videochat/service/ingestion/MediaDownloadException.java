package com.williamcallahan.videochat.service.ingestion;

/**
 * Thrown when media or its metadata cannot be fetched.
 */
public class MediaDownloadException extends RuntimeException {

    public MediaDownloadException(String message) {
        super(message);
    }

    public MediaDownloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
