package com.stepgraph.core.renderer.impl;

import com.stepgraph.core.renderer.GeneratedFile;
import com.stepgraph.core.renderer.GeneratedOutput;
import com.stepgraph.core.renderer.OutputRenderer;
import com.stepgraph.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes each generated file below {@link RenderContext#outputDirectory()} as UTF-8.
 *
 * <p>Missing directories are created and existing files replaced. A file path that
 * resolves outside the output directory is rejected.
 *
 * <pre>{@code
 * new FileSystemRenderer().render(
 *     GeneratedOutput.of(GeneratedFile.of("wall.html", diagram)),
 *     RenderContext.forFile(Paths.get("out/wall.html")));
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path root = context.outputDirectory().toAbsolutePath().normalize();
        logger.debug("Writing {} file(s), {} bytes, to {}", output.files().size(), output.totalBytes(), root);

        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + root, e);
        }

        for (GeneratedFile file : output.files()) {
            write(root, file);
        }
    }

    private void write(Path root, GeneratedFile file) {
        Path target = root.resolve(file.relativePath()).normalize();
        if (!target.startsWith(root)) {
            throw new IllegalStateException("Refusing to write outside " + root + ": " + file.relativePath());
        }

        byte[] bytes = file.content().getBytes(StandardCharsets.UTF_8);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, bytes);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + target, e);
        }
        logger.info("Wrote file: {} ({} bytes)", target, bytes.length);
    }
}
