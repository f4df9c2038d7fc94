package com.stepgraph.core.view;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps entity type names to node colors.
 *
 * <p>Pure function of the type name: configured colors win, every other type hashes into
 * a fixed palette, so a type keeps its color across runs and files.
 */
public class NodePalette {

    static final List<String> PALETTE = List.of(
        "#97c2fc", "#ffa807", "#7be141", "#eb7df4", "#ad85e4",
        "#fb7e81", "#6e6efd", "#ffff00", "#c2fabc", "#fd5a77",
        "#4ad63a", "#c6b9a0", "#ffbbdd", "#8dd3c7", "#fdb462",
        "#bebada"
    );

    private final Map<String, String> typeColors;

    /**
     * Creates a palette.
     *
     * @param typeColors explicit colors keyed by upper case type name
     */
    public NodePalette(Map<String, String> typeColors) {
        this.typeColors = Map.copyOf(Objects.requireNonNull(typeColors, "typeColors must not be null"));
    }

    /**
     * Returns the color for an entity type.
     *
     * @param typeName entity type name, any case
     * @return CSS color
     */
    public String colorFor(String typeName) {
        String key = typeName.toUpperCase();
        String configured = typeColors.get(key);
        if (configured != null) {
            return configured;
        }
        return PALETTE.get(Math.floorMod(key.hashCode(), PALETTE.size()));
    }
}
