package com.williamcallahan.videochat.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Citation persisted with an assistant message and streamed in the {@code sources} event.
 *
 * <p>{@code index} matches the {@code [n]} marker the model was asked to use.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceCitation(
        Integer index,
        String videoId,
        String videoTitle,
        String videoUrl,
        Double startTime,
        Double endTime,
        String text,
        Double score) {}
