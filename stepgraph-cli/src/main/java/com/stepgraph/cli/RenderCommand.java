package com.stepgraph.cli;

import com.stepgraph.core.config.ConfigLoader;
import com.stepgraph.core.config.StepGraphConfig;
import com.stepgraph.core.error.StepValidationException;
import com.stepgraph.core.generator.DiagramGenerator;
import com.stepgraph.core.generator.GeneratedDiagram;
import com.stepgraph.core.generator.GeneratorConfig;
import com.stepgraph.core.graph.Direction;
import com.stepgraph.core.graph.EntityGraph;
import com.stepgraph.core.graph.EntityGraphView;
import com.stepgraph.core.graph.SubgraphExtractor;
import com.stepgraph.core.loader.StepModel;
import com.stepgraph.core.renderer.GeneratedFile;
import com.stepgraph.core.renderer.GeneratedOutput;
import com.stepgraph.core.renderer.OutputRenderer;
import com.stepgraph.core.renderer.RenderContext;
import com.stepgraph.core.view.GraphView;
import com.stepgraph.core.view.GraphViewAdapter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Command to render the entity graph of a STEP/IFC file.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load configuration ({@code stepgraph.yaml} or {@code --config})</li>
 *   <li>Parse the input file and build the entity graph</li>
 *   <li>Without an entity id take the whole graph, otherwise extract the entity's
 *       neighborhood</li>
 *   <li>Adapt the graph to a presenter-neutral view and generate the diagram with the
 *       selected generator</li>
 *   <li>Write the diagram to the output file, or to stdout when the output is {@code -}</li>
 * </ol>
 *
 * <p>If the entity does not exist, nothing is written and the exit status is 1.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * stepgraph render model.ifc model.html
 * stepgraph render model.ifc wall.html '#42' --radius 2 --direction outgoing
 * stepgraph render model.step - 12 --format mermaid
 * }</pre>
 */
@Command(
    name = "render",
    description = "Render the entity graph, or the neighborhood of one entity",
    mixinStandardHelpOptions = true
)
public class RenderCommand extends ModelCommand {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    static final String STDOUT = "-";

    @Spec
    CommandSpec spec;

    @Parameters(index = "1", description = "Output file, or '-' for stdout")
    private String output;

    @Parameters(index = "2", arity = "0..1", description = "Entity id to focus on, e.g. 42 or #42")
    private String entityId;

    @Option(names = {"-r", "--radius"}, description = "Hops around the entity, negative for unbounded (default: 1)")
    private Integer radius;

    @Option(names = {"-d", "--direction"}, description = "References to follow: ${COMPLETION-CANDIDATES} (default: BOTH)")
    private Direction direction;

    @Option(names = {"-f", "--format"}, description = "Generator id: html, mermaid, json (default: from the output extension, else html)")
    private String format;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: stepgraph.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"--network-script"}, description = "Local vis-network.min.js to inline, making the HTML page work offline")
    private Path networkScript;

    @Option(names = {"--no-dangling"}, description = "Do not draw missing nodes for dangling references")
    private boolean noDangling;

    private StepGraphConfig config;
    private DiagramGenerator generator;

    @Override
    public Integer call() {
        // Usage errors surface before any file is read
        parseEntityId();
        config = ConfigLoader.load(configPath);
        generator = format != null
            ? findGenerator(format)
            : findGeneratorByExtension().orElseGet(() -> findGenerator(config.output().format()));
        return super.call();
    }

    @Override
    protected int run(StepModel model) throws StepValidationException {
        PrintStream out = summaryOut();

        EntityGraph graph = model.graph();
        if (!isQuiet()) {
            out.println("✓ Parsed " + model.source() + ": " + graph.size() + " entities, "
                + graph.edges().size() + " references");
        }

        EntityGraphView view = graph;
        Long focus = parseEntityId();
        String title = Paths.get(model.source()).getFileName().toString();
        if (focus != null) {
            int hops = radius != null ? radius : config.view().radius();
            Direction walk = direction != null ? direction : config.view().direction();
            view = new SubgraphExtractor(hops, walk).extract(graph, focus);
            title = title + " - " + graph.get(focus).name() + " " + graph.get(focus).displayType();
            if (!isQuiet()) {
                out.println("✓ Extracted " + view.size() + " entities around #" + focus
                    + " (radius " + hops + ", " + walk + ")");
            }
        }

        GraphViewAdapter adapter = new GraphViewAdapter(withDanglingOverride(config));
        log.debug("Generating {} output for view '{}'", generator.getId(), title);
        GraphView graphView = adapter.toView(view, title);
        GeneratorConfig generatorConfig = GeneratorConfig.from(config);
        if (networkScript != null) {
            generatorConfig = generatorConfig.withNetworkScript(networkScript);
        }
        GeneratedDiagram diagram = generator.generate(graphView, generatorConfig);

        render(diagram);

        if (!isQuiet()) {
            if (!STDOUT.equals(output)) {
                out.println("✓ Wrote " + generator.getDisplayName() + " output to: " + output);
            }
            out.println();
            out.println("Entities:   " + view.size());
            out.println("References: " + view.edges().size());
            out.println("Warnings:   " + view.danglingReferences().size());
        }
        return 0;
    }

    @Override
    protected PrintStream summaryOut() {
        return STDOUT.equals(output) ? System.err : super.summaryOut();
    }

    private void render(GeneratedDiagram diagram) {
        if (STDOUT.equals(output)) {
            findRenderer("console").render(
                GeneratedOutput.of(GeneratedFile.of(diagram)), RenderContext.workingDirectory());
            return;
        }
        Path target = Paths.get(output);
        findRenderer("filesystem").render(
            GeneratedOutput.of(GeneratedFile.of(target.getFileName().toString(), diagram)),
            RenderContext.forFile(target));
    }

    private StepGraphConfig withDanglingOverride(StepGraphConfig config) {
        if (!noDangling) {
            return config;
        }
        StepGraphConfig.ViewConfig view = new StepGraphConfig.ViewConfig(
            config.view().radius(), config.view().direction(), false);
        return new StepGraphConfig(view, config.output(), config.colors());
    }

    /**
     * Parses the optional entity id, accepting {@code 42} and {@code #42}.
     */
    private Long parseEntityId() {
        if (entityId == null) {
            return null;
        }
        String digits = entityId.startsWith("#") ? entityId.substring(1) : entityId;
        try {
            long id = Long.parseLong(digits);
            if (id < 0) {
                throw new NumberFormatException("negative");
            }
            return id;
        } catch (NumberFormatException e) {
            throw new ParameterException(spec.commandLine(), "Invalid entity id: '" + entityId + "'");
        }
    }

    private DiagramGenerator findGenerator(String id) {
        List<String> available = new ArrayList<>();
        for (DiagramGenerator generator : ServiceLoader.load(DiagramGenerator.class)) {
            if (generator.getId().equalsIgnoreCase(id)) {
                return generator;
            }
            available.add(generator.getId());
        }
        throw new ParameterException(spec.commandLine(),
            "Unknown format: '" + id + "'. Available: " + String.join(", ", available));
    }

    /**
     * Picks the generator whose file extension matches the output file, if any.
     */
    private Optional<DiagramGenerator> findGeneratorByExtension() {
        if (STDOUT.equals(output)) {
            return Optional.empty();
        }
        String fileName = Paths.get(output).getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        String extension = fileName.substring(dot + 1);
        for (DiagramGenerator candidate : ServiceLoader.load(DiagramGenerator.class)) {
            if (candidate.getFileExtension().equalsIgnoreCase(extension)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static OutputRenderer findRenderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equals(id)) {
                return renderer;
            }
        }
        throw new IllegalStateException("No renderer registered with id: " + id);
    }
}
