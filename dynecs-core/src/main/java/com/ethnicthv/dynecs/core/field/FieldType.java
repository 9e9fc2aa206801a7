package com.ethnicthv.dynecs.core.field;

/**
 * Tagged numeric value stored in a component field.
 * <p>
 * A field is either an {@link IntField} (64-bit signed) or a {@link FloatField} (64-bit floating point).
 * Values are immutable; arithmetic across kinds lives in {@link FieldArithmetic}.
 */
public sealed interface FieldType permits FieldType.IntField, FieldType.FloatField {

    /**
     * Create an integer field value.
     */
    static FieldType of(long value) {
        return new IntField(value);
    }

    /**
     * Create a floating-point field value.
     */
    static FieldType of(double value) {
        return new FloatField(value);
    }

    FieldKind kind();

    /**
     * Numeric value as long. Float values are truncated toward zero.
     */
    long asLong();

    /**
     * Numeric value as double. Integer values are widened.
     */
    double asDouble();

    record IntField(long value) implements FieldType {
        @Override
        public FieldKind kind() {
            return FieldKind.INTEGER;
        }

        @Override
        public long asLong() {
            return value;
        }

        @Override
        public double asDouble() {
            return value;
        }

        @Override
        public String toString() {
            return "Integer(" + value + ")";
        }
    }

    record FloatField(double value) implements FieldType {
        @Override
        public FieldKind kind() {
            return FieldKind.FLOAT;
        }

        @Override
        public long asLong() {
            return (long) value;
        }

        @Override
        public double asDouble() {
            return value;
        }

        @Override
        public String toString() {
            return "Float(" + value + ")";
        }
    }
}
