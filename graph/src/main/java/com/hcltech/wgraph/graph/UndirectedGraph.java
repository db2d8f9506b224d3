package com.hcltech.wgraph.graph;

import com.hcltech.wgraph.common.IEnvGetter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Undirected graph: every edge is stored in both endpoints' neighbour lists with the same weight.
 * Not thread-safe.
 */
public final class UndirectedGraph implements Graph {
    private static final Logger log = LoggerFactory.getLogger(UndirectedGraph.class);

    private final Map<String, List<Neighbour>> adjacencyTable;
    private final Map<String, List<Neighbour>> readOnlyView;

    public UndirectedGraph() {
        this(GraphConfig.DEFAULT);
    }

    public UndirectedGraph(GraphConfig config) {
        Objects.requireNonNull(config, "config");
        this.adjacencyTable = new HashMap<>(config.initialCapacity());
        this.readOnlyView = Collections.unmodifiableMap(adjacencyTable);
    }

    public static UndirectedGraph fromEnv(IEnvGetter env) {
        GraphConfig config = GraphConfig.fromEnv(env);
        log.info("Creating undirected graph with initialCapacity={}", config.initialCapacity());
        return new UndirectedGraph(config);
    }

    @Override
    public Map<String, List<Neighbour>> adjacencyTableMutable() {
        return adjacencyTable;
    }

    @Override
    public Map<String, List<Neighbour>> adjacencyTable() {
        return readOnlyView;
    }

    @Override
    public boolean addNode(String node) {
        boolean added = Graph.super.addNode(node);
        if (added) log.debug("Added node {}", node);
        return added;
    }

    /** Adds both {@code from → to} and {@code to → from}. A self-loop therefore gets two entries. */
    @Override
    public void addEdge(Edge edge) {
        Graph.super.addEdge(edge);
        adjacencyTable.get(edge.to()).add(new Neighbour(edge.from(), edge.weight()));
        log.debug("Added edge {} <-> {} weight={}", edge.from(), edge.to(), edge.weight());
    }

    @Override
    public String toString() {
        return "UndirectedGraph(" + adjacencyTable + ")";
    }
}
