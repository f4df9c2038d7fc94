package com.stepgraph.core.renderer.impl;

import com.stepgraph.core.renderer.GeneratedFile;
import com.stepgraph.core.renderer.GeneratedOutput;
import com.stepgraph.core.renderer.OutputRenderer;
import com.stepgraph.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Renderer that prints generated content to a stream, standard output by default.
 *
 * <p>Content is printed raw, one file after the other, each ending with a line break.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private final PrintStream out;

    /**
     * Service loader constructor, prints to {@link System#out}.
     */
    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        logger.debug("Printing {} file(s), {} bytes", output.files().size(), output.totalBytes());

        for (GeneratedFile file : output.files()) {
            out.print(file.content());
            if (!file.content().endsWith("\n")) {
                out.println();
            }
        }
        out.flush();
    }
}
