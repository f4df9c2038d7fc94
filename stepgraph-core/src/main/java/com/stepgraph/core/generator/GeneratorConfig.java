package com.stepgraph.core.generator;

import com.stepgraph.core.config.StepGraphConfig;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration for document generation.
 *
 * @param height canvas height for interactive presenters
 * @param width canvas width for interactive presenters
 * @param networkScript local copy of {@code vis-network.min.js} to inline into HTML output,
 *                      null to reference the public CDN build
 */
public record GeneratorConfig(
    String height,
    String width,
    Path networkScript
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        if (height == null || height.isBlank()) {
            height = "800px";
        }
        if (width == null || width.isBlank()) {
            width = "100%";
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(null, null, null);
    }

    /**
     * Creates a configuration from the output section of the project configuration.
     *
     * @param config project configuration
     * @return generator config
     */
    public static GeneratorConfig from(StepGraphConfig config) {
        StepGraphConfig.OutputConfig output = config.output();
        Path script = output.networkScript() == null ? null : Paths.get(output.networkScript());
        return new GeneratorConfig(output.height(), output.width(), script);
    }

    /**
     * Returns a copy that inlines the given script.
     *
     * @param script path to {@code vis-network.min.js}, null for the CDN build
     * @return generator config
     */
    public GeneratorConfig withNetworkScript(Path script) {
        return new GeneratorConfig(height, width, script);
    }
}
