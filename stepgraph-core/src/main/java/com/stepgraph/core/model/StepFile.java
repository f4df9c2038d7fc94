package com.stepgraph.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Result of parsing a complete physical file.
 *
 * @param header HEADER section entries in file order
 * @param instances DATA section instances in file order, across all DATA sections
 */
public record StepFile(
    List<HeaderEntity> header,
    List<EntityRecord> instances
) {
    /**
     * Compact constructor with validation.
     */
    public StepFile {
        header = header == null ? List.of() : List.copyOf(header);
        instances = instances == null ? List.of() : List.copyOf(instances);
    }

    /**
     * Finds a header entry by name.
     *
     * @param name header entity name, e.g. {@code FILE_NAME}
     * @return the first entry with that name
     */
    public Optional<HeaderEntity> headerEntity(String name) {
        return header.stream().filter(h -> h.name().equals(name)).findFirst();
    }

    /**
     * Returns the schema identifiers listed in {@code FILE_SCHEMA}.
     *
     * @return schema names, empty if the header has none
     */
    public List<String> schemas() {
        StringCollector collector = new StringCollector(true);
        headerEntity("FILE_SCHEMA").ifPresent(h -> h.parameters().forEach(p -> p.accept(collector)));
        return collector.strings;
    }

    /**
     * Returns the file name recorded in {@code FILE_NAME}, if any.
     *
     * @return recorded file name
     */
    public Optional<String> recordedFileName() {
        return headerEntity("FILE_NAME")
            .filter(h -> !h.parameters().isEmpty())
            .flatMap(h -> {
                StringCollector collector = new StringCollector(false);
                h.parameters().get(0).accept(collector);
                return collector.strings.stream().findFirst();
            });
    }

    /**
     * Gathers string values, optionally descending into lists.
     */
    private static final class StringCollector implements AttributeValue.Visitor<Void> {

        private final List<String> strings = new ArrayList<>();
        private final boolean descend;

        StringCollector(boolean descend) {
            this.descend = descend;
        }

        @Override
        public Void visitString(AttributeValue.StringValue value) {
            strings.add(value.value());
            return null;
        }

        @Override
        public Void visitList(AttributeValue.ListValue value) {
            if (descend) {
                value.elements().forEach(e -> e.accept(this));
            }
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
        public Void visitReference(AttributeValue.ReferenceValue value) {
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

        @Override
        public Void visitTyped(AttributeValue.TypedValue value) {
            return null;
        }
    }
}
