package com.stepgraph.core.graph;

import com.stepgraph.core.error.DuplicateEntityException;
import com.stepgraph.core.model.DanglingReference;
import com.stepgraph.core.model.EntityRecord;
import com.stepgraph.core.model.Reference;
import com.stepgraph.core.model.StepFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds an {@link EntityGraph} from parsed instances.
 *
 * <p>Runs in two passes because instances may reference ids declared later in the file:
 * <ol>
 *   <li>Index every record by id, rejecting duplicate ids</li>
 *   <li>Collect every reference of every record and fill forward and backward adjacency;
 *       references to unknown ids become {@link DanglingReference} warnings</li>
 * </ol>
 * Reference cycles are allowed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * EntityGraph graph = new EntityGraphBuilder().build(stepFile);
 * graph.successors(2L);    // [1]
 * graph.predecessors(1L);  // [2]
 * }</pre>
 */
public class EntityGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(EntityGraphBuilder.class);

    /**
     * Builds the graph for a parsed file.
     *
     * @param file parsed file
     * @return entity graph
     * @throws DuplicateEntityException if two instances share an id
     */
    public EntityGraph build(StepFile file) throws DuplicateEntityException {
        return build(file.instances());
    }

    /**
     * Builds the graph for a list of records.
     *
     * @param instances records in file order
     * @return entity graph
     * @throws DuplicateEntityException if two instances share an id
     */
    public EntityGraph build(List<EntityRecord> instances) throws DuplicateEntityException {
        Map<Long, EntityRecord> records = indexRecords(instances);

        Map<Long, List<Reference>> outgoing = new HashMap<>();
        Map<Long, List<Reference>> incoming = new HashMap<>();
        List<Reference> edges = new ArrayList<>();
        List<DanglingReference> dangling = new ArrayList<>();

        for (EntityRecord record : records.values()) {
            for (ReferenceCollector.Hit hit : ReferenceCollector.collect(record)) {
                if (!records.containsKey(hit.targetId())) {
                    DanglingReference missing = new DanglingReference(
                        record.id(), hit.targetId(), hit.attributePath(), record.line());
                    log.warn("Dangling reference: {}", missing);
                    dangling.add(missing);
                    continue;
                }
                Reference reference = new Reference(record.id(), hit.targetId(), hit.attributePath());
                edges.add(reference);
                outgoing.computeIfAbsent(record.id(), k -> new ArrayList<>()).add(reference);
                incoming.computeIfAbsent(hit.targetId(), k -> new ArrayList<>()).add(reference);
            }
        }

        log.debug("Built entity graph: {} entities, {} references, {} dangling",
            records.size(), edges.size(), dangling.size());

        return new EntityGraph(records, freeze(outgoing), freeze(incoming), edges, dangling);
    }

    private Map<Long, EntityRecord> indexRecords(List<EntityRecord> instances) throws DuplicateEntityException {
        Map<Long, EntityRecord> records = new LinkedHashMap<>();
        for (EntityRecord record : instances) {
            EntityRecord previous = records.putIfAbsent(record.id(), record);
            if (previous != null) {
                throw new DuplicateEntityException(record.id(), previous.line(), record.line());
            }
        }
        return records;
    }

    private static Map<Long, List<Reference>> freeze(Map<Long, List<Reference>> adjacency) {
        Map<Long, List<Reference>> frozen = new HashMap<>();
        adjacency.forEach((id, refs) -> frozen.put(id, List.copyOf(refs)));
        return Collections.unmodifiableMap(frozen);
    }
}
