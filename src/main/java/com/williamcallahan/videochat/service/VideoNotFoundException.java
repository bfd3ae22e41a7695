package com.williamcallahan.videochat.service;

/**
 * Thrown when an operation names a video that has not been ingested.
 */
public class VideoNotFoundException extends RuntimeException {

    public VideoNotFoundException(String message) {
        super(message);
    }

    public VideoNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
