package com.lunaindex.graph;

import java.util.List;

public record GraphView(List<GraphNode> nodes, List<GraphEdge> edges) {
    public GraphView {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }
}
