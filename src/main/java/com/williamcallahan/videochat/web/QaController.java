package com.williamcallahan.videochat.web;

import com.williamcallahan.videochat.service.generation.GenerationOrchestrator;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * Question answering over ingested transcripts, streamed as SSE.
 */
@RestController
@RequestMapping("/api/qa")
public class QaController extends BaseController {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    private final GenerationOrchestrator orchestrator;
    private final SseSupport sseSupport;

    public QaController(
            GenerationOrchestrator orchestrator, SseSupport sseSupport, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.orchestrator = orchestrator;
        this.sseSupport = sseSupport;
    }

    /**
     * Streams {@code metadata}, {@code token}s, {@code sources} and {@code done}, or a single {@code error}.
     */
    @PostMapping(value = "/ask", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> ask(@Valid @RequestBody AskRequest request, HttpServletResponse response) {
        sseSupport.configureStreamingHeaders(response);
        PIPELINE_LOG.info("NEW QA REQUEST - session={} videos={}", request.sessionId(), request.videoIds());
        return sseSupport.stream(orchestrator.ask(
                request.question(), request.videoIds(), request.sessionId(), request.userId(), request.topK()));
    }

    @PostMapping(value = "/followup", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> followUp(
            @Valid @RequestBody FollowUpRequest request, HttpServletResponse response) {
        sseSupport.configureStreamingHeaders(response);
        PIPELINE_LOG.info("FOLLOW-UP REQUEST - session={}", request.sessionId());
        return sseSupport.stream(orchestrator.followUp(request.question(), request.sessionId(), request.videoIds()));
    }

    @GetMapping("/history/{sessionId}")
    public List<MessageView> history(@PathVariable("sessionId") UUID sessionId) {
        return MessageView.fromAll(orchestrator.history(sessionId));
    }
}
