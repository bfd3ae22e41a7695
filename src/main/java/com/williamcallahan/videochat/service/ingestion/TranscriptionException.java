package com.williamcallahan.videochat.service.ingestion;

/**
 * Thrown when audio cannot be turned into a time-coded transcript.
 */
public class TranscriptionException extends RuntimeException {

    public TranscriptionException(String message) {
        super(message);
    }

    public TranscriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
