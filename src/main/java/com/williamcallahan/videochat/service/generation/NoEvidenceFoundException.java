package com.williamcallahan.videochat.service.generation;

/**
 * Raised when retrieval finds nothing to ground an answer on.
 */
public class NoEvidenceFoundException extends RuntimeException {

    public NoEvidenceFoundException(String message) {
        super(message);
    }

    public NoEvidenceFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
