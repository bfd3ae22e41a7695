package com.williamcallahan.videochat.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.videochat.domain.stream.ErrorEvent;
import com.williamcallahan.videochat.domain.stream.StreamEvent;
import com.williamcallahan.videochat.domain.stream.TokenEvent;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

/**
 * Verifies SSE framing, error fallback and heartbeat behavior for streaming endpoints.
 */
class SseSupportTest {

    private final SseSupport sseSupport = new SseSupport(new ObjectMapper());

    @Test
    void eventNameMatchesPayloadType() {
        ServerSentEvent<String> frame = sseSupport.toServerSentEvent(new TokenEvent("Hello"));

        assertEquals("token", frame.event());
        assertEquals("{\"type\":\"token\",\"content\":\"Hello\"}", frame.data());
    }

    @Test
    void streamCompletesAfterLastDataEvent() {
        Flux<StreamEvent> events = Flux.just(new TokenEvent("A"), new ErrorEvent("stop"));

        StepVerifier.create(sseSupport.stream(events))
                .assertNext(frame -> assertEquals("token", frame.event()))
                .assertNext(frame -> assertEquals("error", frame.event()))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void upstreamFailureBecomesErrorEvent() {
        Flux<StreamEvent> events = Flux.concat(
                Flux.just(new TokenEvent("partial")),
                Flux.error(new IllegalStateException("socket closed")));

        StepVerifier.create(sseSupport.stream(events))
                .assertNext(frame -> assertEquals("token", frame.event()))
                .assertNext(frame -> {
                    assertEquals(SseConstants.EVENT_ERROR, frame.event());
                    assertTrue(frame.data().contains("Streaming failed"), frame.data());
                    assertTrue(!frame.data().contains("socket closed"), frame.data());
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void clientCancelReachesEventSource() {
        AtomicBoolean sourceCancelled = new AtomicBoolean();
        Flux<StreamEvent> events = Flux.<StreamEvent>concat(Flux.just(new TokenEvent("A")), Flux.never())
                .doOnCancel(() -> sourceCancelled.set(true));

        StepVerifier.create(sseSupport.stream(events))
                .assertNext(frame -> assertEquals("token", frame.event()))
                .thenCancel()
                .verify(Duration.ofSeconds(5));

        assertTrue(sourceCancelled.get(), "disconnect should cancel the generation stream");
    }

    @Test
    void heartbeatsAreCommentsUntilUpstreamTerminates() {
        StepVerifier.withVirtualTime(() -> sseSupport.heartbeats(Flux.never(), Duration.ofSeconds(1)))
                .thenAwait(Duration.ofSeconds(2))
                .assertNext(heartbeat -> {
                    assertEquals(SseConstants.COMMENT_KEEPALIVE, heartbeat.comment());
                    assertNull(heartbeat.data());
                })
                .assertNext(heartbeat -> assertEquals(SseConstants.COMMENT_KEEPALIVE, heartbeat.comment()))
                .thenCancel()
                .verify();
    }

    @Test
    void heartbeatsStopWhenUpstreamCompletes() {
        StepVerifier.withVirtualTime(() -> sseSupport.heartbeats(Flux.empty(), Duration.ofSeconds(1)))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void heartbeatsDoNotOverflowWhenDownstreamStartsWithZeroDemand() {
        StepVerifier.withVirtualTime(() -> sseSupport.heartbeats(Flux.never()), 0)
                .thenAwait(Duration.ofSeconds((long) SseConstants.HEARTBEAT_INTERVAL_SECONDS * 3))
                .thenRequest(1)
                .thenAwait(Duration.ofSeconds(SseConstants.HEARTBEAT_INTERVAL_SECONDS))
                .assertNext(heartbeat -> assertTrue(!heartbeat.comment().isBlank()))
                .thenCancel()
                .verify();
    }
}
