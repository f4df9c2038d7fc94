package com.stepgraph.core.loader;

import com.stepgraph.core.graph.EntityGraph;
import com.stepgraph.core.model.StepFile;

import java.time.Duration;
import java.util.Objects;

/**
 * A parsed STEP file together with its entity graph.
 *
 * @param source label of the input, usually the file path
 * @param file parsed file
 * @param graph entity graph built from the file's instances
 * @param parseTime time spent lexing and parsing
 * @param buildTime time spent building the graph
 */
public record StepModel(
    String source,
    StepFile file,
    EntityGraph graph,
    Duration parseTime,
    Duration buildTime
) {
    public StepModel {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        if (parseTime == null) {
            parseTime = Duration.ZERO;
        }
        if (buildTime == null) {
            buildTime = Duration.ZERO;
        }
    }
}
