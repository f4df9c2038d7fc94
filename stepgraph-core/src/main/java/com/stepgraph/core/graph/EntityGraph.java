package com.stepgraph.core.graph;

import com.stepgraph.core.model.DanglingReference;
import com.stepgraph.core.model.EntityRecord;
import com.stepgraph.core.model.Reference;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Resolved entity graph of one STEP file.
 *
 * <p>Sole owner of all {@link EntityRecord}s, indexed by id. Cross-references are plain
 * id lookups; forward ({@link #outgoing(long)}) and backward ({@link #incoming(long)})
 * adjacency are computed once by {@link EntityGraphBuilder} after every record is known.
 * Every id in an adjacency list exists in the graph; references to missing ids are
 * kept apart as {@link DanglingReference}s.
 *
 * <p>Immutable after construction and safe to share between readers.
 */
public final class EntityGraph implements EntityGraphView {

    private final Map<Long, EntityRecord> records;
    private final Map<Long, List<Reference>> outgoing;
    private final Map<Long, List<Reference>> incoming;
    private final List<Reference> edges;
    private final List<DanglingReference> danglingReferences;

    EntityGraph(
        Map<Long, EntityRecord> records,
        Map<Long, List<Reference>> outgoing,
        Map<Long, List<Reference>> incoming,
        List<Reference> edges,
        List<DanglingReference> danglingReferences
    ) {
        this.records = Collections.unmodifiableMap(records);
        this.outgoing = outgoing;
        this.incoming = incoming;
        this.edges = List.copyOf(edges);
        this.danglingReferences = List.copyOf(danglingReferences);
    }

    /**
     * Returns the record with the given id.
     *
     * @param id instance id
     * @return the record
     * @throws IllegalArgumentException if there is no such id
     */
    public EntityRecord get(long id) {
        EntityRecord record = records.get(id);
        if (record == null) {
            throw new IllegalArgumentException("No entity #" + id);
        }
        return record;
    }

    /**
     * Looks up a record.
     *
     * @param id instance id
     * @return the record, or empty if there is no such id
     */
    public Optional<EntityRecord> find(long id) {
        return Optional.ofNullable(records.get(id));
    }

    public boolean contains(long id) {
        return records.containsKey(id);
    }

    /**
     * Returns the edges leaving an entity, one per reference attribute occurrence.
     *
     * @param id instance id
     * @return outgoing edges, empty for unknown ids
     */
    public List<Reference> outgoing(long id) {
        return outgoing.getOrDefault(id, List.of());
    }

    /**
     * Returns the edges pointing at an entity.
     *
     * @param id instance id
     * @return incoming edges, empty for unknown ids
     */
    public List<Reference> incoming(long id) {
        return incoming.getOrDefault(id, List.of());
    }

    /**
     * Returns the distinct ids an entity references.
     *
     * @param id instance id
     * @return referenced ids in attribute order
     */
    public Set<Long> successors(long id) {
        Set<Long> ids = new LinkedHashSet<>();
        outgoing(id).forEach(r -> ids.add(r.targetId()));
        return Collections.unmodifiableSet(ids);
    }

    /**
     * Returns the distinct ids that reference an entity.
     *
     * @param id instance id
     * @return referencing ids in file order
     */
    public Set<Long> predecessors(long id) {
        Set<Long> ids = new LinkedHashSet<>();
        incoming(id).forEach(r -> ids.add(r.sourceId()));
        return Collections.unmodifiableSet(ids);
    }

    /**
     * Returns all instance ids in file order.
     *
     * @return ids
     */
    public Set<Long> ids() {
        return records.keySet();
    }

    /**
     * Counts entities per primary type name.
     *
     * @return type name to count, sorted by type name
     */
    public Map<String, Integer> typeHistogram() {
        Map<String, Integer> histogram = new TreeMap<>();
        records.values().forEach(r -> histogram.merge(r.typeName(), 1, Integer::sum));
        return histogram;
    }

    @Override
    public Collection<EntityRecord> entities() {
        return records.values();
    }

    @Override
    public List<Reference> edges() {
        return edges;
    }

    @Override
    public List<DanglingReference> danglingReferences() {
        return danglingReferences;
    }
}
