package com.stepgraph.core.graph;

import com.stepgraph.core.model.DanglingReference;
import com.stepgraph.core.model.EntityRecord;
import com.stepgraph.core.model.Reference;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only set of entities plus the reference edges between them.
 *
 * <p>Implemented by the whole {@link EntityGraph} and by {@link Subgraph} views of it, so
 * presenters handle both the same way.
 */
public interface EntityGraphView {

    /**
     * Returns the entities of this view in file order.
     *
     * @return entities
     */
    Collection<EntityRecord> entities();

    /**
     * Returns the reference edges whose both ends are in this view.
     *
     * @return edges in source order
     */
    List<Reference> edges();

    /**
     * Returns references from entities of this view to ids missing from the file.
     *
     * @return dangling references
     */
    List<DanglingReference> danglingReferences();

    /**
     * Returns the entity this view is centered on, if any.
     *
     * @return focus entity id
     */
    default Optional<Long> focusId() {
        return Optional.empty();
    }

    /**
     * Returns the number of entities in this view.
     *
     * @return entity count
     */
    default int size() {
        return entities().size();
    }
}
