package com.stepgraph.core.view;

import java.util.Objects;

/**
 * A directed edge of the neutral presentation model.
 *
 * @param from referencing node id
 * @param to referenced node id
 * @param label attribute position(s) of the reference, comma separated when one entity
 *              references the same target more than once
 */
public record GraphEdge(
    String from,
    String to,
    String label
) {
    /**
     * Compact constructor with validation.
     */
    public GraphEdge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
    }
}
