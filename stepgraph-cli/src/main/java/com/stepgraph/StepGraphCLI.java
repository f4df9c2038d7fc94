package com.stepgraph;

import com.stepgraph.cli.ListCommand;
import com.stepgraph.cli.RenderCommand;
import com.stepgraph.cli.SummaryCommand;
import com.stepgraph.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for StepGraph.
 *
 * <p>StepGraph parses ISO-10303-21 (STEP/IFC) files, builds the graph of entity
 * instances and their references, and renders the whole graph or the neighborhood of a
 * single entity as an interactive diagram.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Render the entity graph or one entity's neighborhood</li>
 *   <li>{@code summary} - Print header information and entity statistics</li>
 *   <li>{@code validate} - Check that a file parses and its references resolve</li>
 *   <li>{@code list} - List available generators or renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Whole file as interactive HTML
 * stepgraph render model.ifc model.html
 *
 * # Neighborhood of instance #42, two hops deep
 * stepgraph render model.ifc wall.html 42 --radius 2
 *
 * # Mermaid to stdout
 * stepgraph render model.step - 12 --format mermaid
 * }</pre>
 */
@Command(
    name = "stepgraph",
    mixinStandardHelpOptions = true,
    version = "StepGraph 1.0.0-SNAPSHOT",
    description = "Entity reference graphs for STEP and IFC physical files",
    subcommands = {
        RenderCommand.class,
        SummaryCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class StepGraphCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StepGraphCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("StepGraph - Entity reference graphs for STEP and IFC files");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'stepgraph --help' to see available commands");
        System.out.println("Use 'stepgraph <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return command line ready to execute
     */
    public static CommandLine commandLine() {
        StepGraphCLI cli = new StepGraphCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
