package com.lunaindex.graph;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphQueryResult(
        String query,
        String resolvedFile,
        MatchTier matchTier,
        List<String> candidates,
        List<FileEntry> nodes,
        List<GraphEdge> edges,
        String message) {

    public GraphQueryResult {
        candidates = List.copyOf(candidates);
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public boolean found() {
        return matchTier != MatchTier.NONE;
    }
}
