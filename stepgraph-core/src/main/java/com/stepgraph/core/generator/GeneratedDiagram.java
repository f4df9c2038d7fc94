package com.stepgraph.core.generator;

import java.util.Objects;

/**
 * Output of a {@link DiagramGenerator}.
 *
 * @param name default base name, e.g. {@code entity-graph}
 * @param content diagram text
 * @param fileExtension extension without the dot
 * @param contentType MIME type, e.g. {@code text/html}
 */
public record GeneratedDiagram(
    String name,
    String content,
    String fileExtension,
    String contentType
) {
    public GeneratedDiagram {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
        Objects.requireNonNull(contentType, "contentType must not be null");
    }

    /**
     * Returns the default file name, {@code name.extension}.
     *
     * @return file name
     */
    public String fileName() {
        return name + "." + fileExtension;
    }
}
