package org.salesintel.models.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EditorState {
    IDLE("idle"),
    EDITING("editing");

    private final String wireName;

    EditorState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
