package com.stepgraph.core.renderer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Where a renderer writes.
 *
 * @param outputDirectory directory that relative file paths resolve against
 */
public record RenderContext(Path outputDirectory) {

    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
    }

    /**
     * Context for the working directory, used for console output.
     *
     * @return context
     */
    public static RenderContext workingDirectory() {
        return new RenderContext(Paths.get("."));
    }

    /**
     * Context for the directory that contains {@code target}.
     *
     * @param target output file
     * @return context rooted at the file's parent directory
     */
    public static RenderContext forFile(Path target) {
        Path parent = target.toAbsolutePath().getParent();
        return new RenderContext(parent != null ? parent : Paths.get("."));
    }
}
