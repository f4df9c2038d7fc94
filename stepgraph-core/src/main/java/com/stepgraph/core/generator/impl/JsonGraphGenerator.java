package com.stepgraph.core.generator.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.stepgraph.core.generator.DiagramGenerator;
import com.stepgraph.core.generator.GeneratedDiagram;
import com.stepgraph.core.generator.GeneratorConfig;
import com.stepgraph.core.view.GraphView;

import java.util.Objects;

/**
 * Writes the neutral graph view as JSON, for external renderers and tooling.
 */
public class JsonGraphGenerator implements DiagramGenerator {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getDisplayName() {
        return "JSON Graph Generator";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public String getContentType() {
        return "application/json";
    }

    @Override
    public GeneratedDiagram generate(GraphView view, GeneratorConfig config) {
        Objects.requireNonNull(view, "view must not be null");
        try {
            return new GeneratedDiagram("entity-graph", JSON_MAPPER.writeValueAsString(view) + "\n",
                getFileExtension(), getContentType());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize graph view", e);
        }
    }
}
