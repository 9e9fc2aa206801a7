package com.ethnicthv.dynecs.core.field;

/**
 * Domain-specific unchecked exception raised when integer field arithmetic overflows
 * under {@link OverflowPolicy#STRICT}. Carries both operands for diagnostics.
 */
public class FieldOverflowException extends ArithmeticException {
    private final long left;
    private final long right;

    public FieldOverflowException(long left, long right) {
        super("Integer field overflow: " + left + " + " + right);
        this.left = left;
        this.right = right;
    }

    public long getLeft() {
        return left;
    }

    public long getRight() {
        return right;
    }
}
