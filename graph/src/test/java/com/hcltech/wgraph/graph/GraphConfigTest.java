package com.hcltech.wgraph.graph;

import com.hcltech.wgraph.common.IEnvGetter;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphConfigTest {

    private static IEnvGetter env(Map<String, String> kv) {
        return kv::get;
    }

    @Test
    void fromEnv_defaultsWhenUnset() {
        assertEquals(GraphConfig.DEFAULT, GraphConfig.fromEnv(env(Map.of())));
    }

    @Test
    void fromEnv_readsCapacity() {
        var config = GraphConfig.fromEnv(env(Map.of("GRAPH_INITIAL_CAPACITY", " 128 ")));
        assertEquals(128, config.initialCapacity());
    }

    @Test
    void fromEnv_rejectsNonInteger() {
        var ex = assertThrows(IllegalStateException.class,
                () -> GraphConfig.fromEnv(env(Map.of("GRAPH_INITIAL_CAPACITY", "lots"))));
        assertTrue(ex.getMessage().contains("GRAPH_INITIAL_CAPACITY"));
    }

    @Test
    void negativeCapacity_isRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> GraphConfig.fromEnv(env(Map.of("GRAPH_INITIAL_CAPACITY", "-1"))));
    }
}
