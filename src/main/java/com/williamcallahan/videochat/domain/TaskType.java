package com.williamcallahan.videochat.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Closed set of conversation kinds a session can belong to.
 */
public enum TaskType {
    QA("qa"),
    VIDEO_SUMMARY("video_summary"),
    QUIZ("quiz"),
    /** Reserved for pasted-text summaries; no service produces it yet. */
    TEXT_SUMMARY("text_summary");

    private final String wireValue;

    TaskType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Parses the stored or client-supplied representation.
     *
     * @param raw value such as {@code "video_summary"}
     * @return matching task type
     * @throws IllegalArgumentException for unknown values
     */
    @JsonCreator
    public static TaskType fromWireValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Task type is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TaskType taskType : values()) {
            if (taskType.wireValue.equals(normalized)) {
                return taskType;
            }
        }
        throw new IllegalArgumentException("Unknown task type: " + raw);
    }
}
