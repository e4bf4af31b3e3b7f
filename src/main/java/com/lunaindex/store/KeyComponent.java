package com.lunaindex.store;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record KeyComponent(String name, String description, String lines) {
    public KeyComponent {
        name = name == null ? "" : name;
        description = description == null ? "" : description;
    }

    public KeyComponent(String name, String description) {
        this(name, description, null);
    }
}
