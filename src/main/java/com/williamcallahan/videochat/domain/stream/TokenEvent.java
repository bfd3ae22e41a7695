package com.williamcallahan.videochat.domain.stream;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One incremental fragment of generated text.
 *
 * @param content fragment exactly as produced by the model
 */
@JsonPropertyOrder({"type", "content"})
public record TokenEvent(String content) implements StreamEvent {

    public static final String TYPE = "token";

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }
}
