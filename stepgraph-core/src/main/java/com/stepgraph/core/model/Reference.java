package com.stepgraph.core.model;

import java.util.Objects;

/**
 * A directed reference edge between two entity instances.
 *
 * @param sourceId id of the referencing instance
 * @param targetId id of the referenced instance
 * @param attributePath where in the source the reference sits: 1-based position, dotted
 *                      for nested aggregates ({@code 3.2}), prefixed by the segment type
 *                      for complex instances ({@code REPRESENTATION_ITEM.1})
 */
public record Reference(
    long sourceId,
    long targetId,
    String attributePath
) {
    /**
     * Compact constructor with validation.
     */
    public Reference {
        Objects.requireNonNull(attributePath, "attributePath must not be null");
    }
}
