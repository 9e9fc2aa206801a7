package com.ethnicthv.dynecs.core.field;

import java.util.Objects;

/**
 * Combination rule for {@link FieldType} values.
 * <p>
 * Promotion table:
 * <ul>
 *   <li>Integer + Integer -> Integer (sum)</li>
 *   <li>Integer + Float, Float + Integer -> Float (integer operand widened first)</li>
 *   <li>Float + Float -> Float</li>
 * </ul>
 * The result value does not depend on operand order.
 */
public final class FieldArithmetic {

    private FieldArithmetic() {
    }

    /**
     * Combine two values, wrapping on integer overflow. Total: never throws for non-null input.
     */
    public static FieldType combine(FieldType a, FieldType b) {
        return combine(a, b, OverflowPolicy.WRAPPING);
    }

    /**
     * Combine two values using the given integer overflow policy.
     *
     * @throws FieldOverflowException if both operands are integers, the sum overflows
     *                                and {@code policy} is {@link OverflowPolicy#STRICT}
     */
    public static FieldType combine(FieldType a, FieldType b, OverflowPolicy policy) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        Objects.requireNonNull(policy, "policy");

        if (a instanceof FieldType.IntField ia && b instanceof FieldType.IntField ib) {
            return new FieldType.IntField(addLong(ia.value(), ib.value(), policy));
        }
        return new FieldType.FloatField(a.asDouble() + b.asDouble());
    }

    /**
     * Kind of the value {@link #combine} would produce for operands of these kinds.
     */
    public static FieldKind resultKind(FieldKind a, FieldKind b) {
        return a == FieldKind.INTEGER && b == FieldKind.INTEGER ? FieldKind.INTEGER : FieldKind.FLOAT;
    }

    private static long addLong(long x, long y, OverflowPolicy policy) {
        long sum = x + y;
        // sign of the result differs from both operands only on overflow
        if (policy == OverflowPolicy.STRICT && ((x ^ sum) & (y ^ sum)) < 0) {
            throw new FieldOverflowException(x, y);
        }
        return sum;
    }
}
