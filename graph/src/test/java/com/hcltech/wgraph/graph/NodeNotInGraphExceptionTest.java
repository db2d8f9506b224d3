package com.hcltech.wgraph.graph;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NodeNotInGraphExceptionTest {

    @Test
    void message_isFixed() {
        var ex = new NodeNotInGraphException("q");
        assertEquals("accessing a node that is not in the graph", ex.getMessage());
    }

    @Test
    void label_isCarried_andRendered() {
        var ex = new NodeNotInGraphException("q");
        assertEquals("q", ex.label());
        assertTrue(ex.toString().contains("accessing a node that is not in the graph"));
        assertTrue(ex.toString().contains("q"));
    }

    @Test
    void cause_isKept() {
        var cause = new IllegalStateException("boom");
        var ex = new NodeNotInGraphException("q", cause);
        assertSame(cause, ex.getCause());
        assertEquals(NodeNotInGraphException.MESSAGE, ex.getMessage());
    }

    @Test
    void isUnchecked() {
        RuntimeException ex = new NodeNotInGraphException("q");
        assertInstanceOf(NodeNotInGraphException.class, ex);
    }
}
