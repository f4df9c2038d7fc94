package com.stepgraph.cli;

import com.stepgraph.core.graph.EntityGraph;
import com.stepgraph.core.loader.StepModel;
import com.stepgraph.core.model.DanglingReference;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command to check that a file parses and that its instance names are unique.
 *
 * <p>Dangling references are reported but only fail validation with {@code --strict}.
 */
@Command(
    name = "validate",
    description = "Check that a STEP or IFC file parses and its references resolve",
    mixinStandardHelpOptions = true
)
public class ValidateCommand extends ModelCommand {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Option(names = {"--strict"}, description = "Treat dangling references as errors")
    private boolean strict;

    @Override
    protected int run(StepModel model) {
        EntityGraph graph = model.graph();
        log.debug("Validating {} (strict: {})", model.source(), strict);

        for (DanglingReference reference : graph.danglingReferences()) {
            System.err.println("⚠ " + reference);
        }

        if (strict && !graph.danglingReferences().isEmpty()) {
            System.err.println("✗ " + graph.danglingReferences().size() + " dangling references in " + model.source());
            return 1;
        }

        if (!isQuiet()) {
            summaryOut().println("✓ " + model.source() + " is valid: " + graph.size() + " entities, "
                + graph.edges().size() + " references");
        }
        return 0;
    }
}
