package com.stepgraph.core.renderer;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Files produced by one render request, in write order.
 *
 * @param files generated files
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public static GeneratedOutput of(GeneratedFile... files) {
        return new GeneratedOutput(List.of(files));
    }

    /**
     * Returns the UTF-8 size of all file contents.
     *
     * @return total bytes
     */
    public long totalBytes() {
        return files.stream()
            .mapToLong(file -> file.content().getBytes(StandardCharsets.UTF_8).length)
            .sum();
    }
}
