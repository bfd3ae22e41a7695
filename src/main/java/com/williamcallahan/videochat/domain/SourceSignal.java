package com.williamcallahan.videochat.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ranking signal that surfaced an evidence item.
 */
public enum SourceSignal {
    /** Cosine similarity against the vector index. */
    VECTOR("vector"),
    /** Full-text rank against the content store. */
    LEXICAL("bm25");

    private final String wireValue;

    SourceSignal(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
