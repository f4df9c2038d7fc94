package com.stepgraph.core.view;

import java.util.List;

/**
 * Renderer-neutral graph handed to a presenter.
 *
 * @param title human readable title
 * @param nodes nodes in file order, focus node first for neighborhood views
 * @param edges edges in source order
 * @param focusId id of the focus node, null for whole-file views
 */
public record GraphView(
    String title,
    List<GraphNode> nodes,
    List<GraphEdge> edges,
    String focusId
) {
    /**
     * Compact constructor with validation.
     */
    public GraphView {
        if (title == null) {
            title = "";
        }
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    /**
     * Returns the number of nodes that stand for dangling reference targets.
     *
     * @return missing node count
     */
    public long missingNodeCount() {
        return nodes.stream().filter(GraphNode::missing).count();
    }
}
