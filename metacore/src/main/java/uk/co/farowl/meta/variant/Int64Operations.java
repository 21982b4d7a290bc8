// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.variant;

import static java.lang.invoke.MethodHandles.lookup;
import static uk.co.farowl.meta.variant.BoolOperations.bit;
import static uk.co.farowl.meta.variant.Variant.of;

/**
 * Operations with an {@code INT64} left operand. Arithmetic with a
 * {@code DOUBLE} right operand promotes to {@code DOUBLE}. Division and
 * remainder truncate towards zero, as in Java, and integer division by
 * zero throws {@code ArithmeticException}.
 */
@SuppressWarnings(value = {"unused"})
class Int64Operations extends Operations {

    Int64Operations() { super(Variant.Type.INT64, long.class, lookup()); }

    // @formatter:off
    private static Variant eq(long v, long w) { return of(v == w); }
    private static Variant ne(long v, long w) { return of(v != w); }
    private static Variant lt(long v, long w) { return of(v < w); }
    private static Variant le(long v, long w) { return of(v <= w); }
    private static Variant gt(long v, long w) { return of(v > w); }
    private static Variant ge(long v, long w) { return of(v >= w); }

    private static Variant add(long v, long w) { return of(v + w); }
    private static Variant sub(long v, long w) { return of(v - w); }
    private static Variant mul(long v, long w) { return of(v * w); }
    private static Variant div(long v, long w) { return of(v / w); }
    private static Variant mod(long v, long w) { return of(v % w); }

    private static Variant add(long v, double w) { return of(v + w); }
    private static Variant sub(long v, double w) { return of(v - w); }
    private static Variant mul(long v, double w) { return of(v * w); }
    private static Variant div(long v, double w) { return of(v / w); }
    private static Variant mod(long v, double w) { return of(v % w); }

    private static Variant neg(long v) { return of(-v); }
    private static Variant pos(long v) { return of(v); }

    private static Variant bitand(long v, long w) { return of(v & w); }
    private static Variant bitor(long v, long w) { return of(v | w); }
    private static Variant bitxor(long v, long w) { return of(v ^ w); }
    private static Variant lshift(long v, long w) { return of(v << w); }
    private static Variant rshift(long v, long w) { return of(v >> w); }

    private static Variant bitand(long v, boolean w)
        { return of(v & bit(w)); }
    private static Variant bitor(long v, boolean w)
        { return of(v | bit(w)); }
    private static Variant bitxor(long v, boolean w)
        { return of(v ^ bit(w)); }
    private static Variant lshift(long v, boolean w)
        { return of(v << bit(w)); }
    private static Variant rshift(long v, boolean w)
        { return of(v >> bit(w)); }

    private static Variant bitflip(long v) { return of(~v); }
    // @formatter:on
}
