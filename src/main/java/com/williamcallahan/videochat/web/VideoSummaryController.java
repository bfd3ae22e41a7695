package com.williamcallahan.videochat.web;

import com.williamcallahan.videochat.domain.VideoInfo;
import com.williamcallahan.videochat.service.summary.VideoSummaryService;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

@RestController
@RequestMapping("/api/video-summary")
public class VideoSummaryController extends BaseController {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    private final VideoSummaryService summaryService;
    private final SseSupport sseSupport;

    public VideoSummaryController(
            VideoSummaryService summaryService, SseSupport sseSupport, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.summaryService = summaryService;
        this.sseSupport = sseSupport;
    }

    /**
     * Streams a summary, or a single {@code cached} event when one is stored.
     */
    @PostMapping(value = "/summarize", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> summarize(
            @Valid @RequestBody SummarizeRequest request, HttpServletResponse response) {
        sseSupport.configureStreamingHeaders(response);
        PIPELINE_LOG.info(
                "SUMMARY REQUEST - video={} type={} force={}",
                request.videoId(),
                request.resolvedSummaryType().wireValue(),
                request.forceRegenerate());
        return sseSupport.stream(summaryService.summarize(
                request.videoId(), request.resolvedSummaryType(), request.sessionId(), request.forceRegenerate()));
    }

    @GetMapping("/videos")
    public List<VideoInfo> videos() {
        return summaryService.listVideos();
    }
}
