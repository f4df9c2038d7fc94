package com.stepgraph.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepgraph.StepGraphCLI;
import com.stepgraph.core.error.StepValidationException;
import com.stepgraph.core.loader.StepModel;
import com.stepgraph.core.loader.StepModelLoader;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Base for commands that load one STEP/IFC file.
 *
 * <p>Handles the shared steps: input check, loading, error reporting (plain text on stderr,
 * or the diagnostic map as JSON on stdout with {@code --json}) and the elapsed time line.
 *
 * <p>Exit status: 0 on success, 1 for unreadable or invalid input.
 */
abstract class ModelCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ModelCommand.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    @ParentCommand
    StepGraphCLI parent;

    @Parameters(index = "0", description = "Input STEP or IFC file")
    Path input;

    @Option(names = {"--json"}, description = "Print validation errors as JSON on stdout")
    boolean json;

    @Override
    public Integer call() {
        long start = System.nanoTime();
        int exitCode = execute();
        printElapsed(Duration.ofNanos(System.nanoTime() - start));
        return exitCode;
    }

    private int execute() {
        if (!Files.isRegularFile(input)) {
            System.err.println("Error: No such file " + input);
            return 1;
        }

        try {
            StepModel model = new StepModelLoader().load(input);
            return run(model);
        } catch (StepValidationException e) {
            reportValidationError(e);
            return 1;
        } catch (IOException e) {
            log.debug("Failed to read {}", input, e);
            System.err.println("✗ Failed to read " + input + ": " + e.getMessage());
            return 1;
        } catch (IllegalStateException e) {
            log.debug("Command failed", e);
            System.err.println("✗ " + e.getMessage());
            return 1;
        }
    }

    /**
     * Runs the command against a loaded model.
     *
     * @param model loaded model
     * @return exit code
     * @throws StepValidationException if the request cannot be satisfied for this model
     */
    protected abstract int run(StepModel model) throws StepValidationException;

    /**
     * Stream for progress and summary lines. Standard output unless that carries data.
     *
     * @return summary stream
     */
    protected PrintStream summaryOut() {
        return json ? System.err : System.out;
    }

    protected boolean isQuiet() {
        return parent != null && parent.isQuiet();
    }

    private void reportValidationError(StepValidationException e) {
        if (json) {
            try {
                System.out.println(JSON_MAPPER.writeValueAsString(e.toDiagnostic()));
                return;
            } catch (JsonProcessingException jsonError) {
                log.warn("Failed to serialize diagnostic, falling back to text", jsonError);
            }
        }
        System.err.println(e.getMessage());
    }

    private void printElapsed(Duration elapsed) {
        if (isQuiet()) {
            return;
        }
        summaryOut().println();
        summaryOut().printf("Elapsed time: %d.%03ds%n", elapsed.toSeconds(), elapsed.toMillisPart());
    }
}
