package com.lunaindex.graph;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EdgeType {
    DEPENDS_ON("depends_on"),
    USED_BY("used_by");

    private final String wireName;

    EdgeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
