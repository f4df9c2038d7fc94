package com.stepgraph.core.renderer;

import com.stepgraph.core.generator.GeneratedDiagram;

import java.util.Objects;

/**
 * One output file.
 *
 * @param relativePath path below the render context's output directory, e.g. {@code wall.html}
 * @param content text content
 * @param contentType MIME type, may be null
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }

    /**
     * Wraps a diagram under an explicit file name.
     *
     * @param fileName target file name
     * @param diagram generated diagram
     * @return generated file
     */
    public static GeneratedFile of(String fileName, GeneratedDiagram diagram) {
        return new GeneratedFile(fileName, diagram.content(), diagram.contentType());
    }

    /**
     * Wraps a diagram under its default file name.
     *
     * @param diagram generated diagram
     * @return generated file named {@link GeneratedDiagram#fileName()}
     */
    public static GeneratedFile of(GeneratedDiagram diagram) {
        return of(diagram.fileName(), diagram);
    }
}
