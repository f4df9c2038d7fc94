package com.stepgraph.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A parsed entity instance {@code #id = ...;}.
 *
 * <p>Identity is the instance id; ids are unique within one file.
 *
 * @param id instance id as declared by {@code #id =}
 * @param segments one segment for simple instances, several for complex instances
 * @param line 1-based source line of the {@code #id} token
 * @param offset absolute source offset of the {@code #id} token
 */
public record EntityRecord(
    long id,
    List<EntitySegment> segments,
    int line,
    int offset
) {
    /**
     * Compact constructor with validation.
     */
    public EntityRecord {
        Objects.requireNonNull(segments, "segments must not be null");
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Entity #" + id + " must have at least one segment");
        }
        segments = List.copyOf(segments);
    }

    /**
     * Creates a simple instance with a single segment.
     *
     * @param id instance id
     * @param typeName entity type
     * @param attributes parameters
     * @return entity record with unknown source position
     */
    public static EntityRecord simple(long id, String typeName, List<AttributeValue> attributes) {
        return new EntityRecord(id, List.of(new EntitySegment(typeName, attributes)), 0, 0);
    }

    /**
     * Returns true if this instance combines several entity types.
     *
     * @return true for complex instances
     */
    public boolean isComplex() {
        return segments.size() > 1;
    }

    /**
     * Returns the type of the first segment.
     *
     * @return primary type name
     */
    public String typeName() {
        return segments.get(0).typeName();
    }

    /**
     * Returns all segment types joined for display, e.g. {@code A + B}.
     *
     * @return display type
     */
    public String displayType() {
        if (!isComplex()) {
            return typeName();
        }
        return segments.stream().map(EntitySegment::typeName).collect(Collectors.joining(" + "));
    }

    /**
     * Returns the attributes of a simple instance.
     *
     * @return attribute list of the first segment
     */
    public List<AttributeValue> attributes() {
        return segments.get(0).attributes();
    }

    /**
     * Returns the instance name as written in the file.
     *
     * @return e.g. {@code #12}
     */
    public String name() {
        return "#" + id;
    }
}
