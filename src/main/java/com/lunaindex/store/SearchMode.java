package com.lunaindex.store;

import java.util.Locale;

public enum SearchMode {
    KEYWORD,
    DEPENDENCY,
    COMPONENT,
    EXPORTS;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SearchMode fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return KEYWORD;
        }
        for (SearchMode mode : values()) {
            if (mode.wireName().equalsIgnoreCase(value.strip())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown search type: " + value);
    }
}
