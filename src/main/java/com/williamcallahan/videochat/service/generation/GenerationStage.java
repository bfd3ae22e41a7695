package com.williamcallahan.videochat.service.generation;

/**
 * Stages of one generation request, in order. {@link #ERROR} is reachable from any stage.
 */
public enum GenerationStage {
    RETRIEVING,
    PROMPTING,
    STREAMING,
    PERSISTING,
    DONE,
    ERROR
}
