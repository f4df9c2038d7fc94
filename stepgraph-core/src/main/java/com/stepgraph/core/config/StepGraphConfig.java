package com.stepgraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.stepgraph.core.graph.Direction;
import com.stepgraph.core.graph.SubgraphExtractor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root configuration for StepGraph runs.
 *
 * <p>Loaded from {@code stepgraph.yaml}. Every section and field is optional; missing
 * values fall back to the defaults shown below. Command line options override them.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * view:
 *   radius: 1
 *   direction: BOTH
 *   showDanglingReferences: true
 *
 * output:
 *   format: html
 *   height: "800px"
 *   width: "100%"
 *   labelWrap: 100
 *   networkScript: vendor/vis-network.min.js
 *
 * colors:
 *   focus: indigo
 *   missing: red
 *   types:
 *     IFCWALL: steelblue
 * }</pre>
 *
 * @param view subgraph extraction settings
 * @param output presenter settings
 * @param colors node color settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StepGraphConfig(
    @JsonProperty("view") ViewConfig view,
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("colors") ColorConfig colors
) {
    /**
     * Compact constructor filling missing sections with defaults.
     */
    public StepGraphConfig {
        if (view == null) {
            view = new ViewConfig(null, null, null);
        }
        if (output == null) {
            output = new OutputConfig(null, null, null, null, null);
        }
        if (colors == null) {
            colors = new ColorConfig(null, null, null);
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static StepGraphConfig defaults() {
        return new StepGraphConfig(null, null, null);
    }

    /**
     * Subgraph extraction settings.
     *
     * @param radius hop limit around the focus entity, negative for unbounded
     * @param direction reference direction to follow
     * @param showDanglingReferences whether missing targets are drawn as nodes
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ViewConfig(
        @JsonProperty("radius") Integer radius,
        @JsonProperty("direction") Direction direction,
        @JsonProperty("showDanglingReferences") Boolean showDanglingReferences
    ) {
        public ViewConfig {
            if (radius == null) {
                radius = SubgraphExtractor.DEFAULT_RADIUS;
            }
            if (direction == null) {
                direction = Direction.BOTH;
            }
            if (showDanglingReferences == null) {
                showDanglingReferences = true;
            }
        }
    }

    /**
     * Presenter settings.
     *
     * @param format generator id: html, mermaid or json
     * @param height canvas height for the html presenter
     * @param width canvas width for the html presenter
     * @param labelWrap tooltip wrap width in characters
     * @param networkScript local vis-network build inlined into html output, optional
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("format") String format,
        @JsonProperty("height") String height,
        @JsonProperty("width") String width,
        @JsonProperty("labelWrap") Integer labelWrap,
        @JsonProperty("networkScript") String networkScript
    ) {
        public OutputConfig {
            if (format == null || format.isBlank()) {
                format = "html";
            }
            if (height == null) {
                height = "800px";
            }
            if (width == null) {
                width = "100%";
            }
            if (labelWrap == null) {
                labelWrap = 100;
            }
            if (networkScript != null && networkScript.isBlank()) {
                networkScript = null;
            }
        }
    }

    /**
     * Node colors. Type colors given here are merged over the built-in ones.
     *
     * @param focus color of the focus entity
     * @param missing color of dangling reference targets
     * @param types per entity type colors
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ColorConfig(
        @JsonProperty("focus") String focus,
        @JsonProperty("missing") String missing,
        @JsonProperty("types") Map<String, String> types
    ) {
        /** Built-in colors for the most frequent geometry types */
        public static final Map<String, String> DEFAULT_TYPE_COLORS = Map.of(
            "CARTESIAN_POINT", "lightgrey",
            "PCURVE", "orange",
            "B_SPLINE_CURVE_WITH_KNOTS", "palegreen",
            "B_SPLINE_SURFACE_WITH_KNOTS", "darkkhaki",
            "IFCCARTESIANPOINT", "lightgrey",
            "IFCPOLYLINE", "orange",
            "IFCSHAPEREPRESENTATION", "darkkhaki"
        );

        public ColorConfig {
            if (focus == null) {
                focus = "indigo";
            }
            if (missing == null) {
                missing = "red";
            }
            Map<String, String> merged = new LinkedHashMap<>(DEFAULT_TYPE_COLORS);
            if (types != null) {
                types.forEach((type, color) -> merged.put(type.toUpperCase(), color));
            }
            types = Map.copyOf(merged);
        }
    }
}
