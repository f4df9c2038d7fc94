package com.stepgraph.cli;

import com.stepgraph.core.graph.EntityGraph;
import com.stepgraph.core.loader.StepModel;
import com.stepgraph.core.model.DanglingReference;
import com.stepgraph.core.model.StepFile;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Command to print header information and entity statistics of a file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * stepgraph summary model.ifc
 * stepgraph summary model.step --top 50
 * }</pre>
 */
@Command(
    name = "summary",
    description = "Print schema, entity counts and dangling references of a file",
    mixinStandardHelpOptions = true
)
public class SummaryCommand extends ModelCommand {

    private static final int MAX_DANGLING_LISTED = 20;

    @Option(names = {"--top"}, description = "Number of entity types to list (default: ${DEFAULT-VALUE})", defaultValue = "20")
    private int top;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        if (top < 0) {
            throw new ParameterException(spec.commandLine(), "--top must not be negative: " + top);
        }
        return super.call();
    }

    @Override
    protected int run(StepModel model) {
        PrintStream out = summaryOut();
        StepFile file = model.file();
        EntityGraph graph = model.graph();

        out.println("File:       " + model.source());
        file.recordedFileName().ifPresent(name -> out.println("Name:       " + name));
        if (!file.schemas().isEmpty()) {
            out.println("Schema:     " + String.join(", ", file.schemas()));
        }
        out.println("Entities:   " + graph.size());
        out.println("References: " + graph.edges().size());
        out.println("Dangling:   " + graph.danglingReferences().size());
        out.printf("Parse time: %d ms, build time: %d ms%n",
            model.parseTime().toMillis(), model.buildTime().toMillis());

        List<Map.Entry<String, Integer>> types = new ArrayList<>(graph.typeHistogram().entrySet());
        types.sort(Map.Entry.<String, Integer>comparingByValue().reversed());

        out.println();
        out.println("Entity types (" + types.size() + "):");
        for (Map.Entry<String, Integer> type : types.subList(0, Math.min(top, types.size()))) {
            out.printf("  %8d  %s%n", type.getValue(), type.getKey());
        }
        if (types.size() > top) {
            out.println("  ... " + (types.size() - top) + " more");
        }

        List<DanglingReference> dangling = graph.danglingReferences();
        if (!dangling.isEmpty()) {
            out.println();
            out.println("Dangling references:");
            for (DanglingReference reference : dangling.subList(0, Math.min(MAX_DANGLING_LISTED, dangling.size()))) {
                out.println("  ⚠ " + reference);
            }
            if (dangling.size() > MAX_DANGLING_LISTED) {
                out.println("  ... " + (dangling.size() - MAX_DANGLING_LISTED) + " more");
            }
        }
        return 0;
    }
}
