package com.stepgraph.core.renderer;

/**
 * Writes generated diagrams to a destination.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI). Register
 * implementations in {@code META-INF/services/com.stepgraph.core.renderer.OutputRenderer}.
 *
 * <p>Two renderers ship with the core module:
 * <ul>
 *   <li>{@code filesystem} - writes each file below {@link RenderContext#outputDirectory()}</li>
 *   <li>{@code console} - prints content to standard output, used for the {@code -} target</li>
 * </ul>
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique lowercase identifier for this renderer.
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the generated output to the target destination.
     *
     * @param output files to render
     * @param context rendering context with configuration and settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
