package com.williamcallahan.videochat.domain.stream;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.williamcallahan.videochat.domain.SourceCitation;
import com.williamcallahan.videochat.domain.VideoInfo;
import java.util.List;

/**
 * Terminal success marker carrying the complete response.
 *
 * @param content full response text
 * @param sessionId session the turn was stored in, for follow-ups
 * @param sources citations in prompt numbering order
 * @param videoId subject video for summaries, null otherwise
 * @param videoInfo subject description for summaries, null otherwise
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "content", "session_id", "sources", "video_id", "video_info"})
public record DoneEvent(
        String content, String sessionId, List<SourceCitation> sources, String videoId, VideoInfo videoInfo)
        implements StreamEvent {

    public static final String TYPE = "done";

    public DoneEvent {
        sources = List.copyOf(sources);
    }

    public static DoneEvent of(String content, String sessionId, List<SourceCitation> sources) {
        return new DoneEvent(content, sessionId, sources, null, null);
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }

    @Override
    public boolean terminal() {
        return true;
    }
}
