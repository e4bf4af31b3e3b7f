package com.lunaindex.store;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UsedByEntry(String file, String usage, String lines) {
    public UsedByEntry {
        file = file == null ? "" : file;
        usage = usage == null ? "" : usage;
    }
}
