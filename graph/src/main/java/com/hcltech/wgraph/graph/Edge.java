package com.hcltech.wgraph.graph;

import java.util.Objects;

/** One directed edge entry: from → to with a weight. */
public record Edge(String from, String to, int weight) {
    public Edge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }
}
