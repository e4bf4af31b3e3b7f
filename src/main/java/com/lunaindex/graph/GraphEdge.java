package com.lunaindex.graph;

public record GraphEdge(String from, String to, EdgeType type, String usage) {
}
