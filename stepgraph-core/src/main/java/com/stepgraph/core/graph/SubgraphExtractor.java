package com.stepgraph.core.graph;

import com.stepgraph.core.error.EntityNotFoundException;
import com.stepgraph.core.model.DanglingReference;
import com.stepgraph.core.model.Reference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Extracts the bounded neighborhood of one entity.
 *
 * <p>Breadth-first from the target, following reference edges in the configured
 * {@link Direction} for at most {@code radius} hops. The default (radius 1, both
 * directions) yields the target, every entity it references and every entity
 * referencing it. A negative radius walks the whole reachable component. The visited
 * set makes cycles harmless.
 *
 * <p>The result holds the induced edges: every graph edge whose both ends were selected.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Subgraph around = SubgraphExtractor.oneHop().extract(graph, 42L);
 *
 * // Everything reachable from the entity
 * Subgraph closure = new SubgraphExtractor(-1, Direction.OUTGOING).extract(graph, 42L);
 * }</pre>
 */
public class SubgraphExtractor {

    private static final Logger log = LoggerFactory.getLogger(SubgraphExtractor.class);

    /** Default hop limit */
    public static final int DEFAULT_RADIUS = 1;

    private final int radius;
    private final Direction direction;

    /**
     * Creates an extractor.
     *
     * @param radius maximum number of hops, negative for unbounded
     * @param direction edges to follow
     */
    public SubgraphExtractor(int radius, Direction direction) {
        this.radius = radius;
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
    }

    /**
     * Creates the default one-hop, both-directions extractor.
     *
     * @return extractor
     */
    public static SubgraphExtractor oneHop() {
        return new SubgraphExtractor(DEFAULT_RADIUS, Direction.BOTH);
    }

    /**
     * Extracts the neighborhood of an entity.
     *
     * @param graph entity graph
     * @param targetId focus entity id
     * @return subgraph view
     * @throws EntityNotFoundException if the graph has no such entity
     */
    public Subgraph extract(EntityGraph graph, long targetId) throws EntityNotFoundException {
        Objects.requireNonNull(graph, "graph must not be null");
        if (!graph.contains(targetId)) {
            throw new EntityNotFoundException(targetId);
        }

        Map<Long, Integer> depths = new LinkedHashMap<>();
        depths.put(targetId, 0);
        List<Long> frontier = List.of(targetId);
        int depth = 0;

        while (!frontier.isEmpty() && (radius < 0 || depth < radius)) {
            List<Long> next = new ArrayList<>();
            for (long id : frontier) {
                if (direction.followsOutgoing()) {
                    visit(graph.successors(id), depths, depth + 1, next);
                }
                if (direction.followsIncoming()) {
                    visit(graph.predecessors(id), depths, depth + 1, next);
                }
            }
            frontier = next;
            depth++;
        }

        List<Reference> edges = new ArrayList<>();
        for (long id : depths.keySet()) {
            for (Reference reference : graph.outgoing(id)) {
                if (depths.containsKey(reference.targetId())) {
                    edges.add(reference);
                }
            }
        }

        List<DanglingReference> dangling = new ArrayList<>();
        if (direction.followsOutgoing()) {
            for (DanglingReference missing : graph.danglingReferences()) {
                Integer sourceDepth = depths.get(missing.sourceId());
                if (sourceDepth != null && (radius < 0 || sourceDepth < radius)) {
                    dangling.add(missing);
                }
            }
        }

        log.debug("Extracted subgraph around #{}: {} entities, {} edges (radius {}, direction {})",
            targetId, depths.size(), edges.size(), radius, direction);

        return new Subgraph(graph, targetId, radius, direction, new LinkedHashSet<>(depths.keySet()), edges, dangling);
    }

    private static void visit(Iterable<Long> neighbors, Map<Long, Integer> depths, int depth, List<Long> next) {
        for (long neighbor : neighbors) {
            if (depths.putIfAbsent(neighbor, depth) == null) {
                next.add(neighbor);
            }
        }
    }

    public int radius() {
        return radius;
    }

    public Direction direction() {
        return direction;
    }
}
