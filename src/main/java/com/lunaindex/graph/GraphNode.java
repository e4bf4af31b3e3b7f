package com.lunaindex.graph;

public record GraphNode(String id, String purpose) {
}
