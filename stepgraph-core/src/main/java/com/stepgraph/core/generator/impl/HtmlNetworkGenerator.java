package com.stepgraph.core.generator.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepgraph.core.generator.DiagramGenerator;
import com.stepgraph.core.generator.GeneratedDiagram;
import com.stepgraph.core.generator.GeneratorConfig;
import com.stepgraph.core.view.GraphEdge;
import com.stepgraph.core.view.GraphNode;
import com.stepgraph.core.view.GraphView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Generates a single interactive HTML page from a graph view.
 *
 * <p>The page embeds node and edge data as JSON and draws them with vis-network:
 * pan, zoom, node dragging, hover tooltips with the instance text, per-type colors.
 * The focus node of a neighborhood view is enlarged and centered once the layout settles;
 * missing nodes are drawn as boxes.
 *
 * <p>Page skeleton comes from the {@code templates/entity-graph.html} resource. Its
 * {@code {{NAME}}} placeholders are filled in one pass over the template, so placeholder
 * text inside entity data is left alone.
 *
 * <p>With {@link GeneratorConfig#networkScript()} set, the vis-network build is read from
 * that file and inlined, making the page self-contained. Otherwise the page loads it from
 * {@value #NETWORK_CDN_URL}.
 */
public class HtmlNetworkGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(HtmlNetworkGenerator.class);

    private static final String GENERATOR_ID = "html";
    private static final String GENERATOR_DISPLAY_NAME = "Interactive HTML Network Generator";
    private static final String FILE_EXTENSION = "html";
    private static final String CONTENT_TYPE = "text/html";
    private static final String TEMPLATE = "/templates/entity-graph.html";
    static final String NETWORK_CDN_URL = "https://unpkg.com/vis-network@9.1.9/standalone/umd/vis-network.min.js";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)\\}\\}");

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

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

        Map<String, String> values = new HashMap<>();
        values.put("TITLE", escapeHtml(view.title()));
        values.put("WIDTH", config.width());
        values.put("HEIGHT", config.height());
        values.put("NODE_COUNT", String.valueOf(view.nodes().size()));
        values.put("EDGE_COUNT", String.valueOf(view.edges().size()));
        values.put("NETWORK_SCRIPT", networkScript(config.networkScript()));
        values.put("NODES", toScriptJson(nodeData(view)));
        values.put("EDGES", toScriptJson(edgeData(view)));
        values.put("FOCUS", toScriptJson(view.focusId()));

        String content = fill(loadTemplate(), values);

        log.info("Generated HTML network: {} nodes, {} edges", view.nodes().size(), view.edges().size());
        return new GeneratedDiagram("entity-graph", content, FILE_EXTENSION, CONTENT_TYPE);
    }

    private List<Map<String, Object>> nodeData(GraphView view) {
        List<Map<String, Object>> nodes = new ArrayList<>(view.nodes().size());
        for (GraphNode node : view.nodes()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("id", node.id());
            data.put("label", node.id() + "\n" + node.label());
            data.put("title", node.tooltip());
            data.put("color", node.colorKey());
            data.put("group", node.label());
            if (node.focus()) {
                data.put("size", 24);
                data.put("borderWidth", 3);
            }
            if (node.missing()) {
                data.put("shape", "box");
            }
            nodes.add(data);
        }
        return nodes;
    }

    private List<Map<String, Object>> edgeData(GraphView view) {
        List<Map<String, Object>> edges = new ArrayList<>(view.edges().size());
        for (GraphEdge edge : view.edges()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("from", edge.from());
            data.put("to", edge.to());
            data.put("label", edge.label());
            edges.add(data);
        }
        return edges;
    }

    private String loadTemplate() {
        try (InputStream in = HtmlNetworkGenerator.class.getResourceAsStream(TEMPLATE)) {
            if (in == null) {
                throw new IllegalStateException("HTML template not found on classpath: " + TEMPLATE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read HTML template: " + TEMPLATE, e);
        }
    }

    /**
     * Replaces each known placeholder of the template. Unknown ones stay as they are.
     */
    static String fill(String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length());
        while (matcher.find()) {
            String value = values.getOrDefault(matcher.group(1), matcher.group());
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String networkScript(Path script) {
        if (script == null) {
            return "<script src=\"" + NETWORK_CDN_URL + "\"></script>";
        }
        try {
            String source = Files.readString(script, StandardCharsets.UTF_8);
            log.debug("Inlining vis-network from {} ({} chars)", script, source.length());
            return "<script>\n" + source.replace("</script", "<\\/script") + "\n</script>";
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read network script: " + script, e);
        }
    }

    /**
     * Serializes a value as JSON that is safe inside an inline script element.
     */
    private static String toScriptJson(Object value) {
        try {
            return JSON_MAPPER.writeValueAsString(value).replace("</", "<\\/");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize graph data", e);
        }
    }

    static String escapeHtml(String text) {
        return text.replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;");
    }
}
