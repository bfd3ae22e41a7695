package com.williamcallahan.videochat.web;

import static com.williamcallahan.videochat.web.SseConstants.COMMENT_KEEPALIVE;
import static com.williamcallahan.videochat.web.SseConstants.ERROR_FALLBACK_JSON;
import static com.williamcallahan.videochat.web.SseConstants.EVENT_ERROR;
import static com.williamcallahan.videochat.web.SseConstants.HEARTBEAT_INTERVAL_SECONDS;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.williamcallahan.videochat.domain.stream.ErrorEvent;
import com.williamcallahan.videochat.domain.stream.StreamEvent;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Shared SSE support for the streaming controllers.
 *
 * Serializes protocol events, creates error events and interleaves keepalive heartbeats.
 *
 * @see SseConstants for event constants
 */
@Component
public class SseSupport {
    private static final Logger log = LoggerFactory.getLogger(SseSupport.class);

    private final ObjectWriter jsonWriter;

    /**
     * Creates SSE support wired to the application's ObjectMapper.
     *
     * @param objectMapper JSON mapper for event payloads
     */
    public SseSupport(ObjectMapper objectMapper) {
        this.jsonWriter = objectMapper.writer();
    }

    /**
     * Configures HTTP response headers for SSE streaming through proxies.
     *
     * @param response the servlet response to configure
     */
    public void configureStreamingHeaders(HttpServletResponse response) {
        response.addHeader("X-Accel-Buffering", "no"); // Nginx: disable proxy buffering
        response.addHeader(HttpHeaders.CACHE_CONTROL, "no-cache, no-transform");
    }

    /**
     * Turns a protocol event stream into SSE frames with keepalive comments until it terminates.
     *
     * @param events ordered protocol events
     * @return SSE frames, data events interleaved with heartbeats
     */
    public Flux<ServerSentEvent<String>> stream(Flux<StreamEvent> events) {
        // Two subscribers: the data frames and the heartbeat termination signal. refCount lets a
        // client cancel reach the source once both are gone.
        Flux<ServerSentEvent<String>> dataEvents = events.map(this::toServerSentEvent)
                .onErrorResume(failure -> {
                    log.error("Unhandled failure in event stream", failure);
                    return sseError("Streaming failed");
                })
                .publish()
                .refCount(2);
        return Flux.merge(dataEvents, heartbeats(dataEvents));
    }

    /**
     * Serializes one protocol event; the SSE event name is the event type.
     *
     * @param event protocol event
     * @return SSE frame with the JSON payload
     * @throws IllegalStateException if serialization fails
     */
    public ServerSentEvent<String> toServerSentEvent(StreamEvent event) {
        return ServerSentEvent.<String>builder()
                .event(event.type())
                .data(jsonSerialize(event))
                .build();
    }

    /**
     * Serializes an object to JSON for SSE data payloads.
     *
     * @param objectToSerialize object to serialize
     * @return JSON string representation
     * @throws IllegalStateException if serialization fails
     */
    public String jsonSerialize(Object objectToSerialize) {
        try {
            return jsonWriter.writeValueAsString(objectToSerialize);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize SSE data", e);
        }
    }

    /**
     * Creates a Flux containing a single SSE error event.
     * Falls back to a fixed payload when the error event itself cannot be serialized.
     *
     * @param message user-facing error message
     * @return Flux emitting a single error event
     */
    public Flux<ServerSentEvent<String>> sseError(String message) {
        String json;
        try {
            json = jsonWriter.writeValueAsString(new ErrorEvent(message));
        } catch (JsonProcessingException serializationFailure) {
            log.error("Failed to serialize SSE error payload", serializationFailure);
            json = ERROR_FALLBACK_JSON;
        }
        return Flux.just(ServerSentEvent.<String>builder().event(EVENT_ERROR).data(json).build());
    }

    /**
     * Creates a heartbeat Flux that emits SSE comments at regular intervals.
     *
     * @param terminateOn Flux whose termination stops the heartbeats
     * @return Flux of SSE comment events for keepalive
     */
    public Flux<ServerSentEvent<String>> heartbeats(Flux<?> terminateOn) {
        return heartbeats(terminateOn, Duration.ofSeconds(HEARTBEAT_INTERVAL_SECONDS));
    }

    Flux<ServerSentEvent<String>> heartbeats(Flux<?> terminateOn, Duration interval) {
        return Flux.interval(interval)
                .onBackpressureDrop()
                .takeUntilOther(terminateOn.ignoreElements().onErrorResume(failure -> Mono.empty()))
                .map(tick -> ServerSentEvent.<String>builder()
                        .comment(COMMENT_KEEPALIVE)
                        .build());
    }
}
