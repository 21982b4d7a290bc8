// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.variant;

import uk.co.farowl.meta.variant.Variant.Operator;
import uk.co.farowl.meta.variant.Variant.Type;

/**
 * Thrown by {@link Variant#evaluate(Operator, Variant, Variant)} when
 * no implementation of the operator exists for the types of operand
 * given. Callers that can recover should test first with
 * {@link Variant#canEvaluate(Operator, Type, Type)}.
 */
public class UnsupportedOperatorError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final Operator operator;
    private final Type left;
    private final Type right;

    /**
     * Construct from the operator and the types of the operands.
     *
     * @param operator attempted
     * @param left type of the left operand
     * @param right type of the right operand
     */
    public UnsupportedOperatorError(Operator operator, Type left,
            Type right) {
        super(operator.isUnary()
                ? String.format("unsupported operand type for %s: %s",
                        operator, left)
                : String.format(
                        "unsupported operand types for %s: %s and %s",
                        operator, left, right));
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    /** @return the operator attempted */
    public Operator getOperator() { return operator; }

    /** @return type of the left operand */
    public Type getLeftType() { return left; }

    /** @return type of the right operand */
    public Type getRightType() { return right; }
}
