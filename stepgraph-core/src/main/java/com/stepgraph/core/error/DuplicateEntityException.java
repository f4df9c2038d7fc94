package com.stepgraph.core.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Two instances share the same id.
 */
public class DuplicateEntityException extends StepValidationException {

    private final long id;
    private final int firstLine;
    private final int duplicateLine;

    /**
     * Creates a duplicate id error.
     *
     * @param id duplicated instance id
     * @param firstLine line of the first declaration
     * @param duplicateLine line of the offending declaration
     */
    public DuplicateEntityException(long id, int firstLine, int duplicateLine) {
        super("On line " + duplicateLine + ":\nDuplicate instance name #" + id
            + " (first declared on line " + firstLine + ")");
        this.id = id;
        this.firstLine = firstLine;
        this.duplicateLine = duplicateLine;
    }

    public long id() {
        return id;
    }

    public int firstLine() {
        return firstLine;
    }

    public int duplicateLine() {
        return duplicateLine;
    }

    @Override
    public String type() {
        return "duplicate_name";
    }

    @Override
    public Map<String, Object> toDiagnostic() {
        Map<String, Object> diagnostic = new LinkedHashMap<>();
        diagnostic.put("type", type());
        diagnostic.put("name", "#" + id);
        diagnostic.put("lineno", duplicateLine);
        diagnostic.put("first_lineno", firstLine);
        diagnostic.put("message", getMessage());
        return diagnostic;
    }
}
