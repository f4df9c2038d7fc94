package com.stepgraph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A parameter value of an entity instance.
 *
 * <p>Closed set of variants mirroring the physical file parameter grammar. Consumers
 * dispatch through {@link Visitor}, which has one method per variant.
 *
 * <ul>
 *   <li>{@link StringValue}, {@link IntegerValue}, {@link RealValue}, {@link BooleanValue},
 *       {@link EnumerationValue}, {@link BinaryValue} - primitive scalars</li>
 *   <li>{@link ReferenceValue} - {@code #id} pointer to another instance, the only variant
 *       that contributes a graph edge</li>
 *   <li>{@link UnsetValue} ({@code $}) and {@link DerivedValue} ({@code *})</li>
 *   <li>{@link ListValue} - aggregate, nests to any depth</li>
 *   <li>{@link TypedValue} - {@code TYPE(value)} typed parameter, e.g. {@code IFCLABEL('x')}</li>
 * </ul>
 */
public sealed interface AttributeValue permits
    AttributeValue.StringValue,
    AttributeValue.IntegerValue,
    AttributeValue.RealValue,
    AttributeValue.BooleanValue,
    AttributeValue.EnumerationValue,
    AttributeValue.BinaryValue,
    AttributeValue.ReferenceValue,
    AttributeValue.UnsetValue,
    AttributeValue.DerivedValue,
    AttributeValue.ListValue,
    AttributeValue.TypedValue {

    /** Shared {@code $} instance */
    UnsetValue UNSET = new UnsetValue();

    /** Shared {@code *} instance */
    DerivedValue DERIVED = new DerivedValue();

    /**
     * Dispatches to the visitor method for this variant.
     *
     * @param visitor visitor
     * @param <R> result type
     * @return visitor result
     */
    <R> R accept(Visitor<R> visitor);

    /**
     * One method per variant.
     *
     * @param <R> result type
     */
    interface Visitor<R> {
        R visitString(StringValue value);

        R visitInteger(IntegerValue value);

        R visitReal(RealValue value);

        R visitBoolean(BooleanValue value);

        R visitEnumeration(EnumerationValue value);

        R visitBinary(BinaryValue value);

        R visitReference(ReferenceValue value);

        R visitUnset(UnsetValue value);

        R visitDerived(DerivedValue value);

        R visitList(ListValue value);

        R visitTyped(TypedValue value);
    }

    static StringValue string(String value) {
        return new StringValue(value);
    }

    static IntegerValue integer(long value) {
        return new IntegerValue(value);
    }

    static RealValue real(double value) {
        return new RealValue(value);
    }

    static EnumerationValue enumeration(String literal) {
        return new EnumerationValue(literal);
    }

    static ReferenceValue reference(long id) {
        return new ReferenceValue(id);
    }

    static ListValue list(AttributeValue... elements) {
        return new ListValue(List.of(elements));
    }

    /**
     * Decoded string value (escapes already resolved).
     *
     * @param value decoded text
     */
    record StringValue(String value) implements AttributeValue {
        public StringValue {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    record IntegerValue(long value) implements AttributeValue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInteger(this);
        }
    }

    record RealValue(double value) implements AttributeValue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReal(this);
        }
    }

    /**
     * Boolean literal, written {@code .T.} or {@code .F.} in the file.
     *
     * @param value boolean value
     */
    record BooleanValue(boolean value) implements AttributeValue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBoolean(this);
        }
    }

    /**
     * Enumeration literal without the surrounding periods.
     *
     * @param literal literal such as {@code UNDEFINED}
     */
    record EnumerationValue(String literal) implements AttributeValue {
        public EnumerationValue {
            Objects.requireNonNull(literal, "literal must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEnumeration(this);
        }
    }

    /**
     * Binary literal without the surrounding double quotes.
     *
     * @param encoded leading unused-bit count digit followed by hex digits
     */
    record BinaryValue(String encoded) implements AttributeValue {
        public BinaryValue {
            Objects.requireNonNull(encoded, "encoded must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    record ReferenceValue(long id) implements AttributeValue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReference(this);
        }
    }

    record UnsetValue() implements AttributeValue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnset(this);
        }
    }

    record DerivedValue() implements AttributeValue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDerived(this);
        }
    }

    /**
     * Aggregate parameter.
     *
     * @param elements elements in declaration order
     */
    record ListValue(List<AttributeValue> elements) implements AttributeValue {
        public ListValue {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitList(this);
        }
    }

    /**
     * Typed parameter such as {@code IFCLENGTHMEASURE(2.5)}.
     *
     * @param typeName defined type name
     * @param value wrapped value
     */
    record TypedValue(String typeName, AttributeValue value) implements AttributeValue {
        public TypedValue {
            Objects.requireNonNull(typeName, "typeName must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTyped(this);
        }
    }
}
