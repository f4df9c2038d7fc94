package com.stepgraph.core.view;

import com.stepgraph.core.config.StepGraphConfig;
import com.stepgraph.core.graph.EntityGraphView;
import com.stepgraph.core.model.DanglingReference;
import com.stepgraph.core.model.EntityRecord;
import com.stepgraph.core.model.EntitySegment;
import com.stepgraph.core.model.Reference;
import com.stepgraph.core.parser.StepWriter;
import com.stepgraph.core.util.SourceLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps an entity graph or subgraph to the renderer-neutral {@link GraphView}.
 *
 * <ul>
 *   <li>Node label: entity type ({@code A + B} for complex instances)</li>
 *   <li>Node tooltip: the instance written back in STEP syntax, one segment per line,
 *       wrapped at the configured width</li>
 *   <li>Node color: {@link NodePalette} by primary type, focus and missing colors override</li>
 *   <li>Edges: one per referencing/referenced pair, labelled with the attribute
 *       positions of all references between them</li>
 * </ul>
 * Dangling references become "missing" nodes when enabled, otherwise they are dropped.
 */
public class GraphViewAdapter {

    private static final Logger log = LoggerFactory.getLogger(GraphViewAdapter.class);

    private static final String MISSING_LABEL = "missing";

    private final NodePalette palette;
    private final String focusColor;
    private final String missingColor;
    private final int labelWrap;
    private final boolean showDanglingReferences;

    /**
     * Creates an adapter from configuration.
     *
     * @param config configuration
     */
    public GraphViewAdapter(StepGraphConfig config) {
        this(new NodePalette(config.colors().types()),
            config.colors().focus(),
            config.colors().missing(),
            config.output().labelWrap(),
            config.view().showDanglingReferences());
    }

    /**
     * Creates an adapter.
     *
     * @param palette type color palette
     * @param focusColor color of the focus node
     * @param missingColor color of dangling reference targets
     * @param labelWrap tooltip wrap width, values below 1 disable wrapping
     * @param showDanglingReferences whether to add missing nodes for dangling references
     */
    public GraphViewAdapter(NodePalette palette, String focusColor, String missingColor,
                            int labelWrap, boolean showDanglingReferences) {
        this.palette = Objects.requireNonNull(palette, "palette must not be null");
        this.focusColor = focusColor;
        this.missingColor = missingColor;
        this.labelWrap = labelWrap;
        this.showDanglingReferences = showDanglingReferences;
    }

    /**
     * Builds the presentation model.
     *
     * @param view whole graph or subgraph
     * @param title title for the presenter
     * @return graph view
     */
    public GraphView toView(EntityGraphView view, String title) {
        Objects.requireNonNull(view, "view must not be null");
        Long focus = view.focusId().orElse(null);

        List<GraphNode> nodes = new ArrayList<>();
        for (EntityRecord record : view.entities()) {
            boolean isFocus = focus != null && focus == record.id();
            nodes.add(new GraphNode(
                record.name(),
                record.displayType(),
                tooltip(record),
                isFocus && focusColor != null ? focusColor : palette.colorFor(record.typeName()),
                isFocus,
                false
            ));
        }

        Map<String, List<String>> edgeLabels = new LinkedHashMap<>();
        for (Reference reference : view.edges()) {
            addEdge(edgeLabels, "#" + reference.sourceId(), "#" + reference.targetId(), reference.attributePath());
        }

        if (showDanglingReferences) {
            Set<Long> missingIds = new LinkedHashSet<>();
            for (DanglingReference missing : view.danglingReferences()) {
                missingIds.add(missing.targetId());
                addEdge(edgeLabels, "#" + missing.sourceId(), "#" + missing.targetId(), missing.attributePath());
            }
            for (long id : missingIds) {
                nodes.add(new GraphNode(
                    "#" + id,
                    MISSING_LABEL,
                    "#" + id + " is referenced but not defined",
                    missingColor,
                    false,
                    true
                ));
            }
        }

        List<GraphEdge> edges = new ArrayList<>();
        edgeLabels.forEach((key, labels) -> {
            int separator = key.indexOf('>');
            edges.add(new GraphEdge(key.substring(0, separator), key.substring(separator + 1), String.join(", ", labels)));
        });

        log.debug("Adapted view '{}': {} nodes, {} edges", title, nodes.size(), edges.size());
        return new GraphView(title, nodes, edges, focus != null ? "#" + focus : null);
    }

    /**
     * Formats the tooltip of an entity.
     *
     * @param record entity record
     * @return instance text in STEP syntax, wrapped
     */
    public String tooltip(EntityRecord record) {
        List<String> lines = new ArrayList<>();
        List<EntitySegment> segments = record.segments();
        for (int i = 0; i < segments.size(); i++) {
            String text = StepWriter.writeSegment(segments.get(i));
            if (i == 0) {
                text = record.name() + "=" + text;
            }
            lines.add(SourceLines.wrap(text, labelWrap));
        }
        return String.join("\n", lines);
    }

    private static void addEdge(Map<String, List<String>> edgeLabels, String from, String to, String label) {
        edgeLabels.computeIfAbsent(from + ">" + to, k -> new ArrayList<>()).add(label);
    }
}
