// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.variant;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.invoke.MethodType;

import uk.co.farowl.meta.support.ReflectionError;
import uk.co.farowl.meta.variant.Variant.Operator;

/**
 * {@code Operations} is the base class of the operation handlers for
 * each {@link Variant.Type}. A concrete sub-class defines the operators
 * for which the type is the left operand, as static methods named after
 * {@link Operator#methodName}, taking the Java payload types of the two
 * operands and returning a {@code Variant}. For example, addition of an
 * {@code INT64} and a {@code DOUBLE} is the method
 * {@code Variant add(long, double)} in {@link Int64Operations}.
 * <p>
 * Absence of a method means the operation is not supported.
 */
abstract class Operations {

    /** Shorthand for {@code Variant.class}. */
    protected static final Class<Variant> V = Variant.class;

    /** The type for which this is the left operand handler. */
    final Variant.Type type;

    /** The Java type in which implementations receive the payload. */
    final Class<?> javaClass;

    /** Authorisation to find the implementation methods. */
    private final Lookup lookup;

    /**
     * Constructor accepting the lookup object of the concrete class
     * implementing the operations, permitting look-up of operations
     * within it.
     *
     * @param type the operations handle as the left operand
     * @param javaClass of the payload as implementations receive it
     * @param lookup of the concrete class implementing the operations
     */
    protected Operations(Variant.Type type, Class<?> javaClass,
            Lookup lookup) {
        this.type = type;
        this.javaClass = javaClass;
        this.lookup = lookup;
    }

    /**
     * Find the implementation of a unary operator with this type as
     * operand.
     *
     * @param op to find
     * @return handle of type {@code (T)Variant} or {@code null}
     */
    MethodHandle findUnaryOp(Operator op) {
        return findStatic(op.methodName,
                MethodType.methodType(V, javaClass));
    }

    /**
     * Find the implementation of a binary operator with this type as
     * the left operand and the type handled by {@code other} as the
     * right.
     *
     * @param op to find
     * @param other handler of the right operand type
     * @return handle of type {@code (T, U)Variant} or {@code null}
     */
    MethodHandle findBinaryOp(Operator op, Operations other) {
        return findStatic(op.methodName,
                MethodType.methodType(V, javaClass, other.javaClass));
    }

    private MethodHandle findStatic(String name, MethodType mt) {
        try {
            return lookup.findStatic(lookup.lookupClass(), name, mt);
        } catch (NoSuchMethodException e) {
            return null;
        } catch (IllegalAccessException e) {
            throw new ReflectionError(e, "cannot access %s.%s%s",
                    lookup.lookupClass().getSimpleName(), name, mt);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + type + "]";
    }
}
