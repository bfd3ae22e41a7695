package com.williamcallahan.videochat.service.summary;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Requested depth of a video summary.
 */
public enum SummaryType {
    QUICK("quick"),
    DETAILED("detailed");

    private final String wireValue;

    SummaryType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Parses a wire value; blank means {@link #DETAILED}.
     *
     * @throws IllegalArgumentException for any other value
     */
    @JsonCreator
    public static SummaryType fromWireValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return DETAILED;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (SummaryType type : values()) {
            if (type.wireValue.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("summary_type must be 'quick' or 'detailed': " + raw);
    }
}
