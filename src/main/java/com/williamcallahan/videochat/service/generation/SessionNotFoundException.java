package com.williamcallahan.videochat.service.generation;

/**
 * Thrown when a request names a chat session that does not exist.
 */
public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String message) {
        super(message);
    }

    public SessionNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
