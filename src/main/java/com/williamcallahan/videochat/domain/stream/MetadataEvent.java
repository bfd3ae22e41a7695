package com.williamcallahan.videochat.domain.stream;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.williamcallahan.videochat.domain.VideoInfo;
import java.util.List;

/**
 * Evidence-gathering context, sent once before any token.
 *
 * @param videoInfo subject video for summaries, null for question answering
 * @param videoIds videos the evidence was drawn from
 * @param evidenceCount number of evidence items placed in the prompt
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "video_info", "video_ids", "evidence_count"})
public record MetadataEvent(VideoInfo videoInfo, List<String> videoIds, Integer evidenceCount)
        implements StreamEvent {

    public static final String TYPE = "metadata";

    public static MetadataEvent forVideo(VideoInfo videoInfo) {
        return new MetadataEvent(videoInfo, List.of(videoInfo.videoId()), videoInfo.numChunks());
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }
}
