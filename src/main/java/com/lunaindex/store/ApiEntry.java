package com.lunaindex.store;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiEntry(String signature, String description, String lines) {
    public ApiEntry {
        signature = signature == null ? "" : signature;
        description = description == null ? "" : description;
    }

    public ApiEntry(String signature, String description) {
        this(signature, description, null);
    }

    // text before the parameter list
    public String exportName() {
        int paren = signature.indexOf('(');
        return (paren >= 0 ? signature.substring(0, paren) : signature).strip();
    }
}
