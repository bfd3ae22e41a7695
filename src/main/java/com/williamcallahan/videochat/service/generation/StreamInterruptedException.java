package com.williamcallahan.videochat.service.generation;

/**
 * Wraps a failure of the upstream token stream after generation started.
 */
public class StreamInterruptedException extends RuntimeException {

    public StreamInterruptedException(String message) {
        super(message);
    }

    public StreamInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
