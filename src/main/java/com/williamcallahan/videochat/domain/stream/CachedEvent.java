package com.williamcallahan.videochat.domain.stream;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.williamcallahan.videochat.domain.VideoInfo;

/**
 * A previously generated result returned verbatim.
 *
 * @param content stored response text
 * @param videoId subject video
 * @param videoInfo subject description, when the video still has chunks
 * @param sessionId session holding the stored response
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "content", "video_id", "video_info", "session_id"})
public record CachedEvent(String content, String videoId, VideoInfo videoInfo, String sessionId)
        implements StreamEvent {

    public static final String TYPE = "cached";

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
