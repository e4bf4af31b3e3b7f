package com.lunaindex.store;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CodeLink(String symbol, String path, String lines) {
    public CodeLink(String symbol, String path) {
        this(symbol, path, null);
    }
}
