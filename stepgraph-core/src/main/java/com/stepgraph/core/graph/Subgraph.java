package com.stepgraph.core.graph;

import com.stepgraph.core.model.DanglingReference;
import com.stepgraph.core.model.EntityRecord;
import com.stepgraph.core.model.Reference;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Neighborhood of one entity, produced by {@link SubgraphExtractor}.
 *
 * <p>A view: holds ids only and resolves records through the owning {@link EntityGraph}.
 */
public final class Subgraph implements EntityGraphView {

    private final EntityGraph graph;
    private final long targetId;
    private final int radius;
    private final Direction direction;
    private final Set<Long> ids;
    private final List<Reference> edges;
    private final List<DanglingReference> danglingReferences;

    Subgraph(
        EntityGraph graph,
        long targetId,
        int radius,
        Direction direction,
        Set<Long> ids,
        List<Reference> edges,
        List<DanglingReference> danglingReferences
    ) {
        this.graph = graph;
        this.targetId = targetId;
        this.radius = radius;
        this.direction = direction;
        this.ids = Collections.unmodifiableSet(ids);
        this.edges = List.copyOf(edges);
        this.danglingReferences = List.copyOf(danglingReferences);
    }

    public long targetId() {
        return targetId;
    }

    /**
     * Returns the hop limit this view was extracted with.
     *
     * @return radius, negative for unbounded
     */
    public int radius() {
        return radius;
    }

    public Direction direction() {
        return direction;
    }

    /**
     * Returns the selected ids, focus first, then in discovery order.
     *
     * @return ids
     */
    public Set<Long> ids() {
        return ids;
    }

    public boolean contains(long id) {
        return ids.contains(id);
    }

    public EntityGraph graph() {
        return graph;
    }

    @Override
    public Collection<EntityRecord> entities() {
        return ids.stream().map(graph::get).toList();
    }

    @Override
    public List<Reference> edges() {
        return edges;
    }

    @Override
    public List<DanglingReference> danglingReferences() {
        return danglingReferences;
    }

    @Override
    public Optional<Long> focusId() {
        return Optional.of(targetId);
    }

    @Override
    public int size() {
        return ids.size();
    }
}
