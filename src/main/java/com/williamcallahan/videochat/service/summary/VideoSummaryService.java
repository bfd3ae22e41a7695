package com.williamcallahan.videochat.service.summary;

import com.williamcallahan.videochat.config.AppProperties;
import com.williamcallahan.videochat.domain.SourceCitation;
import com.williamcallahan.videochat.domain.TaskType;
import com.williamcallahan.videochat.domain.VideoInfo;
import com.williamcallahan.videochat.domain.stream.CachedEvent;
import com.williamcallahan.videochat.domain.stream.DoneEvent;
import com.williamcallahan.videochat.domain.stream.ErrorEvent;
import com.williamcallahan.videochat.domain.stream.MetadataEvent;
import com.williamcallahan.videochat.domain.stream.SourcesEvent;
import com.williamcallahan.videochat.domain.stream.StreamEvent;
import com.williamcallahan.videochat.domain.stream.TokenEvent;
import com.williamcallahan.videochat.model.ChatMessage;
import com.williamcallahan.videochat.model.ChatSession;
import com.williamcallahan.videochat.model.Chunk;
import com.williamcallahan.videochat.model.Video;
import com.williamcallahan.videochat.repository.ChunkRepository;
import com.williamcallahan.videochat.repository.VideoRepository;
import com.williamcallahan.videochat.service.VideoNotFoundException;
import com.williamcallahan.videochat.service.generation.ConversationService;
import com.williamcallahan.videochat.service.generation.OpenAIStreamingService;
import com.williamcallahan.videochat.service.generation.PromptTemplates;
import com.williamcallahan.videochat.service.generation.SessionNotFoundException;
import com.williamcallahan.videochat.service.retrieval.HybridRetrievalService;
import com.williamcallahan.videochat.support.PromptTokenBudget;
import com.williamcallahan.videochat.support.TimestampFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Streams quick or detailed summaries of one ingested video.
 *
 * <p>Summaries are stored as assistant messages in a {@code video_summary} session titled
 * {@code Video Summary: {videoId}}; with caching on, the newest stored summary is replayed as a
 * single {@code cached} event instead of calling the model.</p>
 */
@Service
public class VideoSummaryService {
    private static final Logger log = LoggerFactory.getLogger(VideoSummaryService.class);

    static final String SESSION_TITLE_PREFIX = "Video Summary: ";
    private static final String SEGMENT_SEPARATOR = "\n\n";

    private final HybridRetrievalService retrievalService;
    private final VideoRepository videoRepository;
    private final ChunkRepository chunkRepository;
    private final ConversationService conversationService;
    private final OpenAIStreamingService streamingService;
    private final PromptTokenBudget tokenBudget;
    private final AppProperties appProperties;

    public VideoSummaryService(
            HybridRetrievalService retrievalService,
            VideoRepository videoRepository,
            ChunkRepository chunkRepository,
            ConversationService conversationService,
            OpenAIStreamingService streamingService,
            PromptTokenBudget tokenBudget,
            AppProperties appProperties) {
        this.retrievalService = retrievalService;
        this.videoRepository = videoRepository;
        this.chunkRepository = chunkRepository;
        this.conversationService = conversationService;
        this.streamingService = streamingService;
        this.tokenBudget = tokenBudget;
        this.appProperties = appProperties;
    }

    /**
     * Summarizes a video.
     *
     * @param videoId ingested video
     * @param summaryType quick bullets or a detailed structured summary
     * @param sessionId existing session to append to, or null
     * @param forceRegenerate skip the stored summary even when caching is on
     * @return {@code cached}, or {@code metadata}, tokens, {@code sources} and {@code done};
     *     a single {@code error} event on failure
     */
    public Flux<StreamEvent> summarize(
            String videoId, SummaryType summaryType, UUID sessionId, boolean forceRegenerate) {
        return Flux.defer(() -> {
                    String title = SESSION_TITLE_PREFIX + videoId;
                    if (appProperties.getSummary().isCacheEnabled() && !forceRegenerate) {
                        Optional<ChatMessage> cached = conversationService
                                .latestAssistantMessage(TaskType.VIDEO_SUMMARY, title)
                                .filter(message -> !message.isPartial());
                        if (cached.isPresent()) {
                            log.info("Returning cached summary for video={}", videoId);
                            return Flux.just(cachedEvent(videoId, cached.get()));
                        }
                    }

                    List<Chunk> chunks = retrievalService.chunksForVideo(
                            videoId, appProperties.getSummary().getMaxTranscriptChunks());
                    if (chunks.isEmpty()) {
                        throw new VideoNotFoundException("No transcript found for video " + videoId);
                    }
                    ChatSession session = conversationService.resolveSession(
                            sessionId, TaskType.VIDEO_SUMMARY, title, appProperties.getConversation().getDefaultUserId());
                    Video video = videoRepository.findById(videoId).orElse(null);
                    VideoInfo videoInfo = videoInfo(videoId, video, chunks);
                    String prompt = buildPrompt(summaryType, videoInfo, chunks);
                    return stream(session.getId(), videoInfo, prompt);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(failure -> Flux.just(toErrorEvent(videoId, failure)));
    }

    /**
     * Lists ingested videos, newest first.
     */
    public List<VideoInfo> listVideos() {
        List<VideoInfo> videos = new ArrayList<>();
        for (Video video : videoRepository.findAllByOrderByCreatedAtDesc()) {
            long durationSeconds = video.getDurationSeconds() == null ? 0L : Math.round(video.getDurationSeconds());
            videos.add(new VideoInfo(
                    video.getId(),
                    video.getTitle(),
                    video.getSourceUrl(),
                    TimestampFormatter.minutesSeconds(durationSeconds),
                    durationSeconds,
                    (int) chunkRepository.countByVideoId(video.getId())));
        }
        return videos;
    }

    private Flux<StreamEvent> stream(UUID sessionId, VideoInfo videoInfo, String prompt) {
        StringBuffer summary = new StringBuffer();
        List<SourceCitation> sources = List.of(videoSource(videoInfo));

        Flux<StreamEvent> tokens = streamingService
                .streamResponse(PromptTemplates.VIDEO_SUMMARY_SYSTEM_PROMPT, prompt)
                .doOnNext(summary::append)
                .map(TokenEvent::new);

        Flux<StreamEvent> completion = Mono.fromCallable(() -> {
                    conversationService.appendTurn(sessionId, null, summary.toString(), sources, false);
                    log.info("Stored summary for video={} in session={}", videoInfo.videoId(), sessionId);
                    return summary.toString();
                })
                .flatMapMany(content -> Flux.<StreamEvent>just(
                        new SourcesEvent(sources),
                        new DoneEvent(content, sessionId.toString(), sources, videoInfo.videoId(), videoInfo)));

        return Flux.concat(Flux.just(MetadataEvent.forVideo(videoInfo)), tokens, completion);
    }

    String buildPrompt(SummaryType summaryType, VideoInfo videoInfo, List<Chunk> chunks) {
        List<String> segments = new ArrayList<>(chunks.size());
        for (int position = 0; position < chunks.size(); position++) {
            Chunk chunk = chunks.get(position);
            segments.add("[" + (position + 1) + "] [" + TimestampFormatter.minutesSeconds(chunk.getStartTime())
                    + "-" + TimestampFormatter.minutesSeconds(chunk.getEndTime()) + "]\n" + chunk.getText());
        }
        List<String> kept = tokenBudget.leadingBlocksWithin(segments, appProperties.getSummary().getMaxPromptTokens());
        if (kept.size() < segments.size()) {
            log.info("Summary prompt for video={} trimmed to {} of {} segments", videoInfo.videoId(), kept.size(), segments.size());
        }
        String transcript = String.join(SEGMENT_SEPARATOR, kept);
        if (summaryType == SummaryType.QUICK) {
            return PromptTemplates.QUICK_SUMMARY_USER_TEMPLATE.formatted(videoInfo.title(), transcript);
        }
        return PromptTemplates.DETAILED_SUMMARY_USER_TEMPLATE.formatted(videoInfo.title(), videoInfo.duration(), transcript);
    }

    private CachedEvent cachedEvent(String videoId, ChatMessage cached) {
        List<Chunk> chunks = retrievalService.chunksForVideo(
                videoId, appProperties.getSummary().getMaxTranscriptChunks());
        VideoInfo videoInfo = chunks.isEmpty()
                ? null
                : videoInfo(videoId, videoRepository.findById(videoId).orElse(null), chunks);
        return new CachedEvent(cached.getContent(), videoId, videoInfo, cached.getSessionId().toString());
    }

    static VideoInfo videoInfo(String videoId, Video video, List<Chunk> chunks) {
        double first = chunks.get(0).getStartTime();
        double last = chunks.get(chunks.size() - 1).getEndTime();
        long durationSeconds = last > first ? (long) Math.floor(last - first) : 0L;
        String title = video == null || video.getTitle() == null ? videoId : video.getTitle();
        String url = video == null ? null : video.getSourceUrl();
        return new VideoInfo(
                videoId, title, url, TimestampFormatter.minutesSeconds(durationSeconds), durationSeconds, chunks.size());
    }

    private static SourceCitation videoSource(VideoInfo videoInfo) {
        return new SourceCitation(
                1, videoInfo.videoId(), videoInfo.title(), videoInfo.videoUrl(), null, null, null, null);
    }

    private static ErrorEvent toErrorEvent(String videoId, Throwable failure) {
        if (failure instanceof VideoNotFoundException || failure instanceof SessionNotFoundException) {
            log.info("Summary for video={} not possible: {}", videoId, failure.getMessage());
            return new ErrorEvent(failure.getMessage());
        }
        log.error("Summary for video={} failed", videoId, failure);
        return new ErrorEvent("Something went wrong while summarizing the video. Please try again.");
    }
}
