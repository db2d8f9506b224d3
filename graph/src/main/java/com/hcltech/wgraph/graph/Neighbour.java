package com.hcltech.wgraph.graph;

import java.util.Objects;

public record Neighbour(String label, int weight) {
    public Neighbour {
        Objects.requireNonNull(label, "label");
    }
}
