package com.williamcallahan.videochat.domain.stream;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.williamcallahan.videochat.domain.SourceCitation;
import java.util.List;

/**
 * Ordered evidence citations, sent once ahead of {@code done}.
 *
 * @param sources citations in prompt numbering order
 */
@JsonPropertyOrder({"type", "sources"})
public record SourcesEvent(List<SourceCitation> sources) implements StreamEvent {

    public static final String TYPE = "sources";

    public SourcesEvent {
        sources = List.copyOf(sources);
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }
}
