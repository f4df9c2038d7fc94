package com.stepgraph.core.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A requested entity id is not present in the graph.
 */
public class EntityNotFoundException extends StepValidationException {

    private final long id;

    public EntityNotFoundException(long id) {
        super("Entity #" + id + " not found");
        this.id = id;
    }

    public long id() {
        return id;
    }

    @Override
    public String type() {
        return "entity_not_found";
    }

    @Override
    public Map<String, Object> toDiagnostic() {
        Map<String, Object> diagnostic = new LinkedHashMap<>();
        diagnostic.put("type", type());
        diagnostic.put("name", "#" + id);
        diagnostic.put("message", getMessage());
        return diagnostic;
    }
}
