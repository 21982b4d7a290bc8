// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.variant;

import static java.lang.invoke.MethodHandles.constant;
import static java.lang.invoke.MethodHandles.dropArguments;
import static java.lang.invoke.MethodHandles.filterArguments;
import static java.lang.invoke.MethodType.methodType;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.invoke.MethodType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.meta.object.MetaObject;
import uk.co.farowl.meta.support.ReflectionError;
import uk.co.farowl.meta.variant.Variant.Operator;
import uk.co.farowl.meta.variant.Variant.Type;

/**
 * Holder of the operator dispatch table of {@link Variant}. The table
 * is indexed by the type of the left operand, the type of the right
 * operand and the operator, and each non-null entry is a handle of type
 * {@code (Variant, Variant)Variant}. It is built once, when this class
 * is initialised, from the static methods of the operations classes,
 * and is only read thereafter.
 */
final class Evaluators {

    private static final Logger logger =
            LoggerFactory.getLogger(Evaluators.class);

    /** The type of every entry in the table. */
    private static final MethodType BINARY =
            methodType(Variant.class, Variant.class, Variant.class);

    private static final int NTYPES = Type.values().length;
    private static final int NOPS = Operator.values().length;

    /** The dispatch table {@code [left][right][op]}. */
    private static final MethodHandle[][][] TABLE =
            new MethodHandle[NTYPES][NTYPES][NOPS];

    static {
        Operations[] ops = new Operations[NTYPES];
        ops[Type.NULL.ordinal()] = new NullOperations();
        ops[Type.BOOL.ordinal()] = new BoolOperations();
        ops[Type.INT64.ordinal()] = new Int64Operations();
        ops[Type.DOUBLE.ordinal()] = new DoubleOperations();
        ops[Type.STRING.ordinal()] = new StringOperations();
        ops[Type.OBJECT.ordinal()] = new ObjectOperations();

        MethodHandle[] extract = payloadExtractors();
        int count = 0;

        for (Type left : Type.values()) {
            Operations lops = ops[left.ordinal()];
            MethodHandle lx = extract[left.ordinal()];

            for (Operator op : Operator.values()) {
                if (op.unary) {
                    // Same entry whatever the right operand
                    MethodHandle mh = lops.findUnaryOp(op);
                    if (mh != null) {
                        mh = dropArguments(filterArguments(mh, 0, lx), 1,
                                Variant.class);
                        for (Type right : Type.values()) {
                            count += set(left, right, op, mh);
                        }
                    }
                } else {
                    for (Type right : Type.values()) {
                        Operations rops = ops[right.ordinal()];
                        MethodHandle mh = lops.findBinaryOp(op, rops);
                        if (mh != null) {
                            mh = filterArguments(mh, 0, lx,
                                    extract[right.ordinal()]);
                        } else if (left != right) {
                            mh = mixedEquality(op);
                        }
                        count += set(left, right, op, mh);
                    }
                }
            }
        }

        logger.atDebug().log("Variant operator table has {} entries",
                count);
    }

    private Evaluators() {} // no instances

    /**
     * Test whether there is an entry for the given operator and
     * operand types.
     *
     * @param op operator
     * @param a type of left operand
     * @param b type of right operand
     * @return whether an implementation exists
     */
    static boolean canEvaluate(Operator op, Type a, Type b) {
        return TABLE[a.ordinal()][b.ordinal()][op.ordinal()] != null;
    }

    /**
     * Apply the entry for the given operator and operand types.
     * Exceptions raised by the implementation (such as
     * {@code ArithmeticException} on integer division by zero)
     * propagate.
     *
     * @param op operator
     * @param a left operand
     * @param b right operand
     * @return result of the operation
     * @throws UnsupportedOperatorError if there is no entry
     */
    static Variant evaluate(Operator op, Variant a, Variant b)
            throws UnsupportedOperatorError {
        Type at = a.getType(), bt = b.getType();
        MethodHandle mh = TABLE[at.ordinal()][bt.ordinal()][op.ordinal()];
        if (mh == null) {
            throw new UnsupportedOperatorError(op, at, bt);
        }
        try {
            return (Variant)mh.invokeExact(a, b);
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new ReflectionError(t);
        }
    }

    private static int set(Type left, Type right, Operator op,
            MethodHandle mh) {
        if (mh == null) { return 0; }
        assert mh.type().equals(BINARY);
        TABLE[left.ordinal()][right.ordinal()][op.ordinal()] = mh;
        return 1;
    }

    /**
     * Operands of different types are never equal. This is the entry
     * for equality and inequality when no operations class declares an
     * implementation for the pair.
     *
     * @param op operator
     * @return constant result or {@code null} for other operators
     */
    private static MethodHandle mixedEquality(Operator op) {
        Variant result;
        if (op == Operator.EQUAL) {
            result = Variant.FALSE;
        } else if (op == Operator.NOT_EQUAL) {
            result = Variant.TRUE;
        } else {
            return null;
        }
        return dropArguments(constant(Variant.class, result), 0,
                Variant.class, Variant.class);
    }

    /**
     * Handles that take a {@code Variant} of each type to the Java type
     * in which the operations class of that type receives it.
     *
     * @return extractors indexed by type
     */
    private static MethodHandle[] payloadExtractors() {
        Lookup lookup = MethodHandles.lookup();
        MethodHandle[] x = new MethodHandle[NTYPES];
        try {
            x[Type.NULL.ordinal()] = MethodHandles.identity(Variant.class);
            x[Type.BOOL.ordinal()] = lookup.findVirtual(Variant.class,
                    "boolValue", methodType(boolean.class));
            x[Type.INT64.ordinal()] = lookup.findVirtual(Variant.class,
                    "int64Value", methodType(long.class));
            x[Type.DOUBLE.ordinal()] = lookup.findVirtual(Variant.class,
                    "doubleValue", methodType(double.class));
            x[Type.STRING.ordinal()] = lookup.findVirtual(Variant.class,
                    "stringValue", methodType(String.class));
            x[Type.OBJECT.ordinal()] = lookup.findVirtual(Variant.class,
                    "objectValue", methodType(MetaObject.class));
        } catch (NoSuchMethodException | IllegalAccessException e) {
            throw new ReflectionError(e,
                    "cannot find Variant payload accessor");
        }
        return x;
    }
}
