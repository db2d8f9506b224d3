package com.hcltech.wgraph.graph;

/** Thrown by lookups that do not create missing nodes. */
public final class NodeNotInGraphException extends RuntimeException {
    public static final String MESSAGE = "accessing a node that is not in the graph";

    private final String label;

    public NodeNotInGraphException(String label) {
        super(MESSAGE);
        this.label = label;
    }

    public NodeNotInGraphException(String label, Throwable cause) {
        super(MESSAGE, cause);
        this.label = label;
    }

    /** The label that was looked up. */
    public String label() { return label; }

    @Override
    public String toString() {
        return getClass().getSimpleName() + ": " + MESSAGE + " (" + label + ")";
    }
}
