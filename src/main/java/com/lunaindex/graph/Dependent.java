package com.lunaindex.graph;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Dependent(String file, String usage, String lines) {
}
