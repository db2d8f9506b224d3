package com.hcltech.wgraph.graph;

import com.hcltech.wgraph.common.errorsor.ErrorsOr;

import java.util.*;

/**
 * Weighted graph over string labels, stored as an adjacency table
 * (label → neighbours in insertion order).
 * <p>
 * Implementations only supply the table; everything else is defaulted here.
 * The default {@link #addEdge(Edge)} records the forward entry only, which is
 * directed behaviour. {@link UndirectedGraph} overrides it to add the reverse entry too.
 */
public interface Graph {

    /** The live table. Callers that mutate it are responsible for its invariants. */
    Map<String, List<Neighbour>> adjacencyTableMutable();

    /** Read-only view of the live table (not a copy). */
    Map<String, List<Neighbour>> adjacencyTable();

    /** @return true if the node was added, false if it was already present */
    default boolean addNode(String node) {
        Objects.requireNonNull(node, "node");
        if (contains(node)) return false;
        adjacencyTableMutable().put(node, new ArrayList<>());
        return true;
    }

    /** Adds {@code from → to}, creating either endpoint if missing. Duplicates are kept. */
    default void addEdge(Edge edge) {
        addNode(edge.from());
        addNode(edge.to());
        adjacencyTableMutable().get(edge.from()).add(new Neighbour(edge.to(), edge.weight()));
    }

    default void addEdge(String from, String to, int weight) {
        addEdge(new Edge(from, to, weight));
    }

    /**
     * Like {@link #addEdge(Edge)} but never creates nodes.
     *
     * @throws NodeNotInGraphException if either endpoint is absent; the graph is unchanged
     */
    default void addEdgeStrict(Edge edge) {
        if (!contains(edge.from())) throw new NodeNotInGraphException(edge.from());
        if (!contains(edge.to())) throw new NodeNotInGraphException(edge.to());
        addEdge(edge);
    }

    /** Value if both endpoints exist, otherwise one error per missing endpoint. */
    default ErrorsOr<Edge> checkEndpoints(Edge edge) {
        List<String> errors = new ArrayList<>();
        if (!contains(edge.from())) errors.add(NodeNotInGraphException.MESSAGE + ": " + edge.from());
        if (!edge.to().equals(edge.from()) && !contains(edge.to()))
            errors.add(NodeNotInGraphException.MESSAGE + ": " + edge.to());
        return errors.isEmpty() ? ErrorsOr.lift(edge) : ErrorsOr.errors(errors);
    }

    default boolean contains(String node) {
        return adjacencyTable().containsKey(node);
    }

    /**
     * Read-only view of a node's neighbours, in insertion order.
     *
     * @throws NodeNotInGraphException if the node is absent
     */
    default List<Neighbour> neighbours(String node) {
        List<Neighbour> list = adjacencyTable().get(node);
        if (list == null) throw new NodeNotInGraphException(node);
        return Collections.unmodifiableList(list);
    }

    /** Snapshot of the labels present now. No defined order. */
    default Set<String> nodes() {
        return new HashSet<>(adjacencyTable().keySet());
    }

    /** Every neighbour entry as an edge; an undirected edge therefore appears once per direction. */
    default List<Edge> edges() {
        List<Edge> edges = new ArrayList<>();
        for (var entry : adjacencyTable().entrySet()) {
            for (Neighbour n : entry.getValue()) {
                edges.add(new Edge(entry.getKey(), n.label(), n.weight()));
            }
        }
        return edges;
    }

    default int nodeCount() {
        return adjacencyTable().size();
    }

    default int edgeEntryCount() {
        int count = 0;
        for (List<Neighbour> list : adjacencyTable().values()) count += list.size();
        return count;
    }
}
