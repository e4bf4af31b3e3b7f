package com.lunaindex.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExternalDependency(@JsonProperty("package") String packageName, String usage, String lines) {
    public ExternalDependency {
        packageName = packageName == null ? "" : packageName;
        usage = usage == null ? "" : usage;
    }

    public ExternalDependency(String packageName, String usage) {
        this(packageName, usage, null);
    }
}
