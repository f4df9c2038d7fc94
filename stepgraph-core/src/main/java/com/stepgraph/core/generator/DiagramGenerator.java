package com.stepgraph.core.generator;

import com.stepgraph.core.view.GraphView;

/**
 * Interface for presenters that turn a {@link GraphView} into a document.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI). The CLI picks
 * one by id, or by the extension of the requested output file.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class DotGenerator implements DiagramGenerator {
 *     public String getId() { return "dot"; }
 *     public String getDisplayName() { return "Graphviz DOT Generator"; }
 *     public String getFileExtension() { return "dot"; }
 *     public String getContentType() { return "text/vnd.graphviz"; }
 *
 *     public GeneratedDiagram generate(GraphView view, GeneratorConfig config) {
 *         StringBuilder sb = new StringBuilder("digraph {\n");
 *         view.edges().forEach(e -> sb.append("  \"").append(e.from()).append("\" -> \"")
 *             .append(e.to()).append("\";\n"));
 *         return new GeneratedDiagram("graph", sb.append("}\n").toString(), "dot", getContentType());
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.stepgraph.core.generator.DiagramGenerator}
 *
 * @see GraphView
 * @see GeneratorConfig
 * @see GeneratedDiagram
 */
public interface DiagramGenerator {

    /**
     * Returns unique identifier for this generator, lowercase (e.g. "html", "mermaid").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name used in CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated documents, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Returns the MIME type of generated documents.
     *
     * @return content type
     */
    String getContentType();

    /**
     * Generates a document from the graph view.
     *
     * <p>An empty view must still produce a valid document.
     *
     * @param view graph to present
     * @param config generation settings
     * @return generated document
     */
    GeneratedDiagram generate(GraphView view, GeneratorConfig config);
}
