package com.hcltech.wgraph.graph;

import com.hcltech.wgraph.common.IEnvGetter;

/** Sizing for a graph's adjacency table. */
public record GraphConfig(int initialCapacity) {
    public static final String INITIAL_CAPACITY_ENV = "GRAPH_INITIAL_CAPACITY";
    public static final int DEFAULT_INITIAL_CAPACITY = 16;

    public static final GraphConfig DEFAULT = new GraphConfig(DEFAULT_INITIAL_CAPACITY);

    public GraphConfig {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must be >= 0 but was " + initialCapacity);
        }
    }

    public static GraphConfig fromEnv(IEnvGetter env) {
        return new GraphConfig(IEnvGetter.getIntOr(env, INITIAL_CAPACITY_ENV, DEFAULT_INITIAL_CAPACITY));
    }
}
