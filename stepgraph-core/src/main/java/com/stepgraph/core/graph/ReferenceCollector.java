package com.stepgraph.core.graph;

import com.stepgraph.core.model.AttributeValue;
import com.stepgraph.core.model.EntityRecord;
import com.stepgraph.core.model.EntitySegment;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects every entity reference inside a record, descending into aggregates, typed
 * parameters and complex instance segments.
 *
 * <p>Each hit carries its attribute path: {@code 2}, {@code 3.1} for the first element of
 * the third attribute, {@code SEGMENT_TYPE.2} inside complex instances.
 */
final class ReferenceCollector implements AttributeValue.Visitor<Void> {

    /**
     * A reference found in a record.
     *
     * @param targetId referenced id
     * @param attributePath attribute path of the occurrence
     */
    record Hit(long targetId, String attributePath) {
    }

    private final List<Hit> hits = new ArrayList<>();
    private String path;

    private ReferenceCollector() {
    }

    /**
     * Collects the references of one record.
     *
     * @param record entity record
     * @return references in attribute order, duplicates kept
     */
    static List<Hit> collect(EntityRecord record) {
        ReferenceCollector collector = new ReferenceCollector();
        for (EntitySegment segment : record.segments()) {
            String prefix = record.isComplex() ? segment.typeName() + "." : "";
            List<AttributeValue> attributes = segment.attributes();
            for (int i = 0; i < attributes.size(); i++) {
                collector.path = prefix + (i + 1);
                attributes.get(i).accept(collector);
            }
        }
        return collector.hits;
    }

    @Override
    public Void visitReference(AttributeValue.ReferenceValue value) {
        hits.add(new Hit(value.id(), path));
        return null;
    }

    @Override
    public Void visitList(AttributeValue.ListValue value) {
        String base = path;
        List<AttributeValue> elements = value.elements();
        for (int i = 0; i < elements.size(); i++) {
            path = base + "." + (i + 1);
            elements.get(i).accept(this);
        }
        path = base;
        return null;
    }

    @Override
    public Void visitTyped(AttributeValue.TypedValue value) {
        return value.value().accept(this);
    }

    @Override
    public Void visitString(AttributeValue.StringValue value) {
        return null;
    }

    @Override
    public Void visitInteger(AttributeValue.IntegerValue value) {
        return null;
    }

    @Override
    public Void visitReal(AttributeValue.RealValue value) {
        return null;
    }

    @Override
    public Void visitBoolean(AttributeValue.BooleanValue value) {
        return null;
    }

    @Override
    public Void visitEnumeration(AttributeValue.EnumerationValue value) {
        return null;
    }

    @Override
    public Void visitBinary(AttributeValue.BinaryValue value) {
        return null;
    }

    @Override
    public Void visitUnset(AttributeValue.UnsetValue value) {
        return null;
    }

    @Override
    public Void visitDerived(AttributeValue.DerivedValue value) {
        return null;
    }
}
