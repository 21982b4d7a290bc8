// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.variant;

import static java.lang.invoke.MethodHandles.lookup;
import static uk.co.farowl.meta.variant.Variant.of;

/**
 * Operations with a {@code BOOL} left operand. The logical operators
 * treat the operands as truth values. The bitwise operators treat them
 * as 1 and 0, accept an {@code INT64} right operand and produce
 * {@code INT64}.
 */
@SuppressWarnings(value = {"unused"})
class BoolOperations extends Operations {

    BoolOperations() { super(Variant.Type.BOOL, boolean.class, lookup()); }

    // @formatter:off
    private static Variant eq(boolean v, boolean w) { return of(v == w); }
    private static Variant ne(boolean v, boolean w) { return of(v != w); }
    private static Variant lt(boolean v, boolean w)
        { return of(Boolean.compare(v, w) < 0); }
    private static Variant le(boolean v, boolean w)
        { return of(Boolean.compare(v, w) <= 0); }
    private static Variant gt(boolean v, boolean w)
        { return of(Boolean.compare(v, w) > 0); }
    private static Variant ge(boolean v, boolean w)
        { return of(Boolean.compare(v, w) >= 0); }

    private static Variant and(boolean v, boolean w) { return of(v && w); }
    private static Variant or(boolean v, boolean w) { return of(v || w); }
    private static Variant xor(boolean v, boolean w) { return of(v ^ w); }
    private static Variant not(boolean v) { return of(!v); }

    private static Variant bitand(boolean v, boolean w)
        { return of(bit(v) & bit(w)); }
    private static Variant bitor(boolean v, boolean w)
        { return of(bit(v) | bit(w)); }
    private static Variant bitxor(boolean v, boolean w)
        { return of(bit(v) ^ bit(w)); }
    private static Variant lshift(boolean v, boolean w)
        { return of(bit(v) << bit(w)); }
    private static Variant rshift(boolean v, boolean w)
        { return of(bit(v) >> bit(w)); }

    private static Variant bitand(boolean v, long w)
        { return of(bit(v) & w); }
    private static Variant bitor(boolean v, long w)
        { return of(bit(v) | w); }
    private static Variant bitxor(boolean v, long w)
        { return of(bit(v) ^ w); }
    private static Variant lshift(boolean v, long w)
        { return of(bit(v) << w); }
    private static Variant rshift(boolean v, long w)
        { return of(bit(v) >> w); }

    private static Variant bitflip(boolean v) { return of(~bit(v)); }
    // @formatter:on

    /**
     * The integer value of a {@code boolean} in bitwise operations.
     *
     * @param v to convert
     * @return 1 or 0
     */
    static long bit(boolean v) { return v ? 1L : 0L; }
}
