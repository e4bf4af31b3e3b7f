package com.lunaindex.store;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record InternalDependency(String path, String usage, String lines) {
    public InternalDependency {
        path = path == null ? "" : path;
        usage = usage == null ? "" : usage;
    }

    public InternalDependency(String path, String usage) {
        this(path, usage, null);
    }
}
