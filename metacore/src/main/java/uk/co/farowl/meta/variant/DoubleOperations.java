// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.variant;

import static java.lang.invoke.MethodHandles.lookup;
import static uk.co.farowl.meta.variant.Variant.of;

/**
 * Operations with a {@code DOUBLE} left operand. An {@code INT64} right
 * operand is promoted to {@code double}.
 */
@SuppressWarnings(value = {"unused"})
class DoubleOperations extends Operations {

    DoubleOperations() {
        super(Variant.Type.DOUBLE, double.class, lookup());
    }

    // @formatter:off
    private static Variant eq(double v, double w) { return of(v == w); }
    private static Variant ne(double v, double w) { return of(v != w); }
    private static Variant lt(double v, double w) { return of(v < w); }
    private static Variant le(double v, double w) { return of(v <= w); }
    private static Variant gt(double v, double w) { return of(v > w); }
    private static Variant ge(double v, double w) { return of(v >= w); }

    private static Variant add(double v, double w) { return of(v + w); }
    private static Variant sub(double v, double w) { return of(v - w); }
    private static Variant mul(double v, double w) { return of(v * w); }
    private static Variant div(double v, double w) { return of(v / w); }
    private static Variant mod(double v, double w) { return of(v % w); }

    private static Variant add(double v, long w) { return of(v + w); }
    private static Variant sub(double v, long w) { return of(v - w); }
    private static Variant mul(double v, long w) { return of(v * w); }
    private static Variant div(double v, long w) { return of(v / w); }
    private static Variant mod(double v, long w) { return of(v % w); }

    private static Variant neg(double v) { return of(-v); }
    private static Variant pos(double v) { return of(v); }
    // @formatter:on
}
