package com.stepgraph.core.model;

/**
 * A reference to an id with no instance in the file.
 *
 * <p>Reported as a warning; the edge is left out of the graph adjacency.
 *
 * @param sourceId id of the referencing instance
 * @param targetId missing id
 * @param attributePath attribute position of the reference
 * @param line source line of the referencing instance
 */
public record DanglingReference(
    long sourceId,
    long targetId,
    String attributePath,
    int line
) {
    @Override
    public String toString() {
        return "#" + sourceId + " [" + attributePath + "] references missing #" + targetId + " (line " + line + ")";
    }
}
