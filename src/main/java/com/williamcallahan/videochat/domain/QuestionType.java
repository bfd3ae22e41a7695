package com.williamcallahan.videochat.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Kinds of quiz question the generator can produce.
 */
public enum QuestionType {
    MCQ("mcq"),
    YES_NO("yes_no");

    private final String wireValue;

    QuestionType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static QuestionType fromWireValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return MCQ;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (QuestionType questionType : values()) {
            if (questionType.wireValue.equals(normalized)) {
                return questionType;
            }
        }
        throw new IllegalArgumentException("Unknown question type: " + raw);
    }
}
