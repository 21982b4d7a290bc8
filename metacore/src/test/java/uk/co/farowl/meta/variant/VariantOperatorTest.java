// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.variant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static uk.co.farowl.meta.variant.Variant.Operator.ADD;
import static uk.co.farowl.meta.variant.Variant.Operator.AND;
import static uk.co.farowl.meta.variant.Variant.Operator.BIT_AND;
import static uk.co.farowl.meta.variant.Variant.Operator.BIT_FLIP;
import static uk.co.farowl.meta.variant.Variant.Operator.BIT_OR;
import static uk.co.farowl.meta.variant.Variant.Operator.DIVIDE;
import static uk.co.farowl.meta.variant.Variant.Operator.EQUAL;
import static uk.co.farowl.meta.variant.Variant.Operator.LESS;
import static uk.co.farowl.meta.variant.Variant.Operator.MOD;
import static uk.co.farowl.meta.variant.Variant.Operator.MULTIPLY;
import static uk.co.farowl.meta.variant.Variant.Operator.NEGATIVE;
import static uk.co.farowl.meta.variant.Variant.Operator.NOT;
import static uk.co.farowl.meta.variant.Variant.Operator.NOT_EQUAL;
import static uk.co.farowl.meta.variant.Variant.Operator.SHIFT_LEFT;
import static uk.co.farowl.meta.variant.Variant.Operator.SUBTRACT;
import static uk.co.farowl.meta.variant.Variant.Operator.XOR;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import uk.co.farowl.meta.object.ManualObject;
import uk.co.farowl.meta.variant.Variant.Operator;
import uk.co.farowl.meta.variant.Variant.Type;

/**
 * Test the operator dispatch table of {@link Variant}, through
 * {@link Variant#canEvaluate(Operator, Type, Type)} and
 * {@link Variant#evaluate(Operator, Variant, Variant)}.
 */
@DisplayName("Variant operators")
class VariantOperatorTest {

    static class Thing extends ManualObject {}

    /** One example value of each type. */
    private static List<Variant> examples() {
        return List.of(Variant.NULL, Variant.TRUE, Variant.of(3),
                Variant.of(2.5), Variant.of("s"), Variant.of(new Thing()));
    }

    @Test
    void integer_addition() {
        assertTrue(Variant.canEvaluate(ADD, Type.INT64, Type.INT64));
        Variant r = Variant.evaluate(ADD, Variant.of(3), Variant.of(4));
        assertEquals(Type.INT64, r.getType());
        assertEquals(7L, r.asInt64());
    }

    @Test
    void mixed_arithmetic_is_double() {
        Variant r = Variant.of(3).evaluate(MULTIPLY, Variant.of(0.5));
        assertEquals(Variant.of(1.5), r);
        r = Variant.of(0.5).evaluate(SUBTRACT, Variant.of(3));
        assertEquals(Variant.of(-2.5), r);
    }

    @Test
    void integer_division_truncates() {
        assertEquals(Variant.of(-3),
                Variant.of(-7).evaluate(DIVIDE, Variant.of(2)));
        assertEquals(Variant.of(-1),
                Variant.of(-7).evaluate(MOD, Variant.of(2)));
        assertEquals(Variant.of(3.5),
                Variant.of(7.0).evaluate(DIVIDE, Variant.of(2)));
    }

    @Test
    void integer_division_by_zero() {
        assertThrows(ArithmeticException.class,
                () -> Variant.of(1).evaluate(DIVIDE, Variant.of(0)));
        assertThrows(ArithmeticException.class,
                () -> Variant.of(1).evaluate(MOD, Variant.of(0)));
    }

    @Test
    void string_concatenation() {
        assertEquals(Variant.of("I AM SB"),
                Variant.of("I AM ").evaluate(ADD, Variant.of("SB")));
        assertTrue(Variant.of("a").evaluate(LESS, Variant.of("b")).asBool());
    }

    @Test
    void string_and_integer_do_not_add() {
        assertFalse(Variant.canEvaluate(ADD, Type.STRING, Type.INT64));
        UnsupportedOperatorError e = assertThrows(
                UnsupportedOperatorError.class,
                () -> Variant.evaluate(ADD, Variant.of("s"), Variant.of(1)));
        assertSame(ADD, e.getOperator());
        assertEquals(Type.STRING, e.getLeftType());
        assertEquals(Type.INT64, e.getRightType());
    }

    @Test
    void ordering_needs_same_type() {
        assertTrue(Variant.canEvaluate(LESS, Type.DOUBLE, Type.DOUBLE));
        assertFalse(Variant.canEvaluate(LESS, Type.INT64, Type.DOUBLE));
        assertFalse(Variant.canEvaluate(LESS, Type.NULL, Type.NULL));
        assertFalse(Variant.canEvaluate(LESS, Type.OBJECT, Type.OBJECT));
    }

    @Test
    void unary_ignores_right_operand() {
        for (Type t : Type.values()) {
            assertTrue(Variant.canEvaluate(NEGATIVE, Type.INT64, t));
            assertTrue(Variant.canEvaluate(NOT, Type.BOOL, t));
        }
        assertEquals(Variant.of(-3), Variant.of(3).evaluate(NEGATIVE));
        assertEquals(Variant.of(-2.5),
                Variant.evaluate(NEGATIVE, Variant.of(2.5), Variant.of("x")));
        assertFalse(Variant.canEvaluate(NEGATIVE, Type.STRING, Type.NULL));
    }

    @Test
    void logical_operators_on_bool() {
        assertEquals(Variant.FALSE, Variant.TRUE.evaluate(AND, Variant.FALSE));
        assertEquals(Variant.TRUE, Variant.TRUE.evaluate(XOR, Variant.FALSE));
        assertEquals(Variant.FALSE, Variant.TRUE.evaluate(NOT));
        assertFalse(Variant.canEvaluate(AND, Type.INT64, Type.INT64));
    }

    @Test
    void bitwise_mixes_bool_and_integer() {
        assertEquals(Variant.of(1), Variant.TRUE.evaluate(BIT_AND, Variant.of(3)));
        assertEquals(Variant.of(7), Variant.of(6).evaluate(BIT_OR, Variant.TRUE));
        assertEquals(Variant.of(1),
                Variant.TRUE.evaluate(BIT_AND, Variant.TRUE));
        assertEquals(Variant.of(-2), Variant.TRUE.evaluate(BIT_FLIP));
        assertEquals(Variant.of(8),
                Variant.of(1).evaluate(SHIFT_LEFT, Variant.of(3)));
        assertFalse(Variant.canEvaluate(BIT_AND, Type.DOUBLE, Type.INT64));
    }

    @Test
    void objects_equal_by_identity() {
        Thing t = new Thing();
        Variant a = Variant.of(t), b = Variant.of(new Thing());
        assertEquals(Variant.TRUE, a.evaluate(EQUAL, Variant.of(t)));
        assertEquals(Variant.TRUE, a.evaluate(NOT_EQUAL, b));
    }

    /**
     * Equality is defined for every pair of types, and is true only for
     * operands of the same type and value.
     *
     * @param left type of left operand
     */
    @ParameterizedTest(name = "{0} == every type")
    @EnumSource(Type.class)
    void equality_is_total(Type left) {
        List<Variant> values = examples();
        Variant v = values.get(left.ordinal());
        for (Variant w : values) {
            assertTrue(Variant.canEvaluate(EQUAL, left, w.getType()));
            assertTrue(Variant.canEvaluate(NOT_EQUAL, left, w.getType()));
            boolean same = v.getType() == w.getType();
            assertEquals(same, Variant.evaluate(EQUAL, v, w).asBool());
            assertEquals(!same, Variant.evaluate(NOT_EQUAL, v, w).asBool());
        }
    }

    /**
     * Whatever the operator, {@code canEvaluate} agrees with whether
     * {@code evaluate} throws {@link UnsupportedOperatorError}.
     *
     * @param op operator to test
     */
    @ParameterizedTest(name = "{0} agrees with canEvaluate")
    @EnumSource(Operator.class)
    void can_evaluate_agrees(Operator op) {
        for (Variant v : examples()) {
            for (Variant w : examples()) {
                if (Variant.canEvaluate(op, v.getType(), w.getType())) {
                    // Non-zero examples, so no ArithmeticException
                    Variant.evaluate(op, v, w);
                } else {
                    assertThrows(UnsupportedOperatorError.class,
                            () -> Variant.evaluate(op, v, w));
                }
            }
        }
    }
}
