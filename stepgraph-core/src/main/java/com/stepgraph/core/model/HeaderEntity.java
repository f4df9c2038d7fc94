package com.stepgraph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A HEADER section entry such as {@code FILE_SCHEMA(('IFC4'));}.
 *
 * @param name header entity name
 * @param parameters parameter list
 */
public record HeaderEntity(
    String name,
    List<AttributeValue> parameters
) {
    /**
     * Compact constructor with validation.
     */
    public HeaderEntity {
        Objects.requireNonNull(name, "name must not be null");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }
}
