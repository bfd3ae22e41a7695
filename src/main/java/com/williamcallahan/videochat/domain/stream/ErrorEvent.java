package com.williamcallahan.videochat.domain.stream;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Terminal failure marker. A stream ending with this event is incomplete.
 *
 * @param content human-readable description
 */
@JsonPropertyOrder({"type", "content"})
public record ErrorEvent(String content) implements StreamEvent {

    public static final String TYPE = "error";

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
