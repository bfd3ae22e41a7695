package com.williamcallahan.videochat.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Author of a persisted chat message.
 */
public enum MessageRole {
    USER("user"),
    ASSISTANT("assistant");

    private final String wireValue;

    MessageRole(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public static MessageRole fromWireValue(String raw) {
        for (MessageRole role : values()) {
            if (role.wireValue.equals(raw)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown message role: " + raw);
    }
}
