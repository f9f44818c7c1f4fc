package io.histingest.progress;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Stage {
    EXTRACTION("extraction"),
    TRANSFORMATION("transformation"),
    VALIDATION("validation"),
    STORAGE("storage");

    private final String wireName;

    Stage(String wireName) { this.wireName = wireName; }

    @JsonValue
    public String wireName() { return wireName; }
}
