package com.stepgraph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One {@code TYPE(params)} record of an entity instance.
 *
 * <p>Simple instances have exactly one segment; complex instances have one segment per
 * entity type of the multiple-inheritance combination.
 *
 * @param typeName entity type name as written in the file
 * @param attributes parameter list in declaration order
 */
public record EntitySegment(
    String typeName,
    List<AttributeValue> attributes
) {
    /**
     * Compact constructor with validation.
     */
    public EntitySegment {
        Objects.requireNonNull(typeName, "typeName must not be null");
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }
}
