package com.stepgraph.core.view;

import java.util.Objects;

/**
 * A node of the neutral presentation model.
 *
 * @param id node id, the instance name such as {@code #12}
 * @param label short label, the entity type
 * @param tooltip formatted attribute listing, lines separated by {@code \n}
 * @param colorKey color derived from the entity type
 * @param focus true for the entity a neighborhood view is centered on
 * @param missing true for dangling reference targets with no instance
 */
public record GraphNode(
    String id,
    String label,
    String tooltip,
    String colorKey,
    boolean focus,
    boolean missing
) {
    /**
     * Compact constructor with validation.
     */
    public GraphNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(label, "label must not be null");
        if (tooltip == null) {
            tooltip = "";
        }
    }
}
