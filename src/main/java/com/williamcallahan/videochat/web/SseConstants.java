package com.williamcallahan.videochat.web;

/**
 * SSE event naming and streaming parameters shared by the streaming controllers.
 */
public final class SseConstants {

    /** SSE event type for error notifications sent to the client. */
    public static final String EVENT_ERROR = "error";

    /** SSE comment content for keepalive heartbeats. */
    public static final String COMMENT_KEEPALIVE = "keepalive";

    /** Heartbeat interval in seconds to keep SSE connections alive through proxies. */
    public static final int HEARTBEAT_INTERVAL_SECONDS = 20;

    /** Fallback payload when an error event itself cannot be serialized. */
    public static final String ERROR_FALLBACK_JSON =
            "{\"type\":\"error\",\"content\":\"Error serialization failed\"}";

    private SseConstants() {
        // Non-instantiable utility class
    }
}
