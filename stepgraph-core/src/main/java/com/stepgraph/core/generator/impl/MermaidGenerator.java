package com.stepgraph.core.generator.impl;

import com.stepgraph.core.generator.DiagramGenerator;
import com.stepgraph.core.generator.GeneratedDiagram;
import com.stepgraph.core.generator.GeneratorConfig;
import com.stepgraph.core.view.GraphEdge;
import com.stepgraph.core.view.GraphNode;
import com.stepgraph.core.view.GraphView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Generates a Mermaid flowchart embedded in Markdown.
 *
 * <p>Nodes read {@code #id TYPE}; each distinct color becomes a {@code classDef} so nodes
 * of one type share a fill. Edge labels carry attribute positions.
 *
 * <p>Output is meant for small views (neighborhoods); Mermaid renderers struggle with
 * whole-file graphs of thousands of nodes.
 */
public class MermaidGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGenerator.class);

    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Diagram Generator";
    private static final String FILE_EXTENSION = "md";
    private static final String CONTENT_TYPE = "text/markdown";

    private static final String MARKDOWN_HEADER_PREFIX = "# ";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";
    private static final String GRAPH_LR = "graph LR\n";
    private static final String NO_ENTITIES_NODE = "  empty[No entities found]\n";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public String getContentType() {
        return CONTENT_TYPE;
    }

    @Override
    public GeneratedDiagram generate(GraphView view, GeneratorConfig config) {
        Objects.requireNonNull(view, "view must not be null");
        Objects.requireNonNull(config, "config must not be null");

        StringBuilder sb = new StringBuilder();
        sb.append(MARKDOWN_HEADER_PREFIX).append(view.title()).append("\n\n");
        sb.append(CODE_BLOCK_START);
        sb.append(GRAPH_LR);

        if (view.nodes().isEmpty()) {
            sb.append(NO_ENTITIES_NODE);
        } else {
            appendNodes(sb, view);
            appendEdges(sb, view);
            appendClasses(sb, view);
        }

        sb.append(CODE_BLOCK_END);

        log.info("Generated Mermaid diagram: {} nodes, {} edges", view.nodes().size(), view.edges().size());
        return new GeneratedDiagram("entity-graph", sb.toString(), FILE_EXTENSION, CONTENT_TYPE);
    }

    private void appendNodes(StringBuilder sb, GraphView view) {
        for (GraphNode node : view.nodes()) {
            String open = node.missing() ? "[/" : "[\"";
            String close = node.missing() ? "/]" : "\"]";
            sb.append("  ").append(sanitizeId(node.id())).append(open)
                .append(escape(node.id() + " " + node.label())).append(close).append("\n");
        }
    }

    private void appendEdges(StringBuilder sb, GraphView view) {
        for (GraphEdge edge : view.edges()) {
            sb.append("  ").append(sanitizeId(edge.from()));
            if (edge.label() != null && !edge.label().isEmpty()) {
                sb.append(" -->|\"").append(escape(edge.label())).append("\"| ");
            } else {
                sb.append(" --> ");
            }
            sb.append(sanitizeId(edge.to())).append("\n");
        }
    }

    private void appendClasses(StringBuilder sb, GraphView view) {
        Map<String, String> classes = new LinkedHashMap<>();
        for (GraphNode node : view.nodes()) {
            if (node.colorKey() == null) {
                continue;
            }
            String className = classes.computeIfAbsent(node.colorKey(), c -> "c" + classes.size());
            sb.append("  class ").append(sanitizeId(node.id())).append(' ').append(className).append("\n");
        }
        classes.forEach((color, className) ->
            sb.append("  classDef ").append(className).append(" fill:").append(color).append("\n"));
    }

    /**
     * Turns an instance name into a Mermaid node id, {@code #12} becomes {@code e12}.
     */
    static String sanitizeId(String id) {
        return "e" + id.replaceAll("[^a-zA-Z0-9_]", "");
    }

    /**
     * Escapes label text with Mermaid entity codes, {@code #} first.
     */
    static String escape(String text) {
        return text.replace("#", "#35;").replace("\"", "#quot;");
    }
}
