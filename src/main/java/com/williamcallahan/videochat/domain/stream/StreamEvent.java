package com.williamcallahan.videochat.domain.stream;

/**
 * One event of the server-to-client generation protocol.
 *
 * <p>The event {@link #type()} doubles as the SSE event name and as the {@code type} field of the
 * JSON payload. {@code cached}, {@code done} and {@code error} are terminal.
 */
public sealed interface StreamEvent
        permits MetadataEvent, TokenEvent, SourcesEvent, CachedEvent, DoneEvent, ErrorEvent {

    /**
     * Returns the protocol event type.
     *
     * @return event type such as {@code "token"}
     */
    String type();

    /**
     * Reports whether no further events follow this one.
     *
     * @return true for terminal events
     */
    default boolean terminal() {
        return false;
    }
}
