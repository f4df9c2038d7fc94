package com.stepgraph.core.parser;

import com.stepgraph.core.lexer.StepStrings;
import com.stepgraph.core.model.AttributeValue;
import com.stepgraph.core.model.EntityRecord;
import com.stepgraph.core.model.EntitySegment;

import java.util.List;

/**
 * Serializes parsed values back to physical file syntax.
 *
 * <p>Output parses back to an equal value tree with {@link StepParser}. Reals keep a
 * decimal point ({@code 0.}, {@code 1.5E-7}); strings are re-escaped with
 * {@link StepStrings#encodeLiteral(String)}.
 */
public final class StepWriter {

    private StepWriter() {
        // Utility class
    }

    /**
     * Writes a complete instance statement, e.g. {@code #2=LINE('L',#1,#1);}.
     *
     * @param record entity record
     * @return statement text
     */
    public static String writeInstance(EntityRecord record) {
        StringBuilder sb = new StringBuilder();
        sb.append('#').append(record.id()).append('=');
        if (record.isComplex()) {
            sb.append('(');
            record.segments().forEach(segment -> appendSegment(sb, segment));
            sb.append(')');
        } else {
            appendSegment(sb, record.segments().get(0));
        }
        return sb.append(';').toString();
    }

    /**
     * Writes one segment, e.g. {@code POINT('P1',(0.,0.,0.))}.
     *
     * @param segment segment
     * @return segment text
     */
    public static String writeSegment(EntitySegment segment) {
        StringBuilder sb = new StringBuilder();
        appendSegment(sb, segment);
        return sb.toString();
    }

    /**
     * Writes a parenthesized parameter list.
     *
     * @param parameters parameters
     * @return list text including parentheses
     */
    public static String writeParameters(List<AttributeValue> parameters) {
        StringBuilder sb = new StringBuilder();
        appendParameters(sb, parameters);
        return sb.toString();
    }

    /**
     * Writes a single value.
     *
     * @param value value
     * @return value text
     */
    public static String writeValue(AttributeValue value) {
        StringBuilder sb = new StringBuilder();
        value.accept(new Appender(sb));
        return sb.toString();
    }

    /**
     * Formats a real the way physical files write them: always with a decimal point.
     *
     * @param value real value
     * @return formatted real
     */
    public static String formatReal(double value) {
        String text = Double.toString(value);
        if (text.endsWith(".0")) {
            return text.substring(0, text.length() - 1);
        }
        return text.replace(".0E", ".E");
    }

    private static void appendSegment(StringBuilder sb, EntitySegment segment) {
        sb.append(segment.typeName());
        appendParameters(sb, segment.attributes());
    }

    private static void appendParameters(StringBuilder sb, List<AttributeValue> parameters) {
        sb.append('(');
        Appender appender = new Appender(sb);
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            parameters.get(i).accept(appender);
        }
        sb.append(')');
    }

    private static final class Appender implements AttributeValue.Visitor<Void> {

        private final StringBuilder sb;

        private Appender(StringBuilder sb) {
            this.sb = sb;
        }

        @Override
        public Void visitString(AttributeValue.StringValue value) {
            sb.append(StepStrings.encodeLiteral(value.value()));
            return null;
        }

        @Override
        public Void visitInteger(AttributeValue.IntegerValue value) {
            sb.append(value.value());
            return null;
        }

        @Override
        public Void visitReal(AttributeValue.RealValue value) {
            sb.append(formatReal(value.value()));
            return null;
        }

        @Override
        public Void visitBoolean(AttributeValue.BooleanValue value) {
            sb.append(value.value() ? ".T." : ".F.");
            return null;
        }

        @Override
        public Void visitEnumeration(AttributeValue.EnumerationValue value) {
            sb.append('.').append(value.literal()).append('.');
            return null;
        }

        @Override
        public Void visitBinary(AttributeValue.BinaryValue value) {
            sb.append('"').append(value.encoded()).append('"');
            return null;
        }

        @Override
        public Void visitReference(AttributeValue.ReferenceValue value) {
            sb.append('#').append(value.id());
            return null;
        }

        @Override
        public Void visitUnset(AttributeValue.UnsetValue value) {
            sb.append('$');
            return null;
        }

        @Override
        public Void visitDerived(AttributeValue.DerivedValue value) {
            sb.append('*');
            return null;
        }

        @Override
        public Void visitList(AttributeValue.ListValue value) {
            appendParameters(sb, value.elements());
            return null;
        }

        @Override
        public Void visitTyped(AttributeValue.TypedValue value) {
            sb.append(value.typeName()).append('(');
            value.value().accept(this);
            sb.append(')');
            return null;
        }
    }
}
