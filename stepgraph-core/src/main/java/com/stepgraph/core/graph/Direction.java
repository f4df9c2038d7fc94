package com.stepgraph.core.graph;

/**
 * Which reference edges subgraph extraction follows.
 */
public enum Direction {
    /** Entities the focus references */
    OUTGOING,

    /** Entities that reference the focus */
    INCOMING,

    /** Both directions */
    BOTH;

    boolean followsOutgoing() {
        return this != INCOMING;
    }

    boolean followsIncoming() {
        return this != OUTGOING;
    }
}
