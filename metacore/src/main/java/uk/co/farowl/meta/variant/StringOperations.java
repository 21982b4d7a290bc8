// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.variant;

import static java.lang.invoke.MethodHandles.lookup;
import static uk.co.farowl.meta.variant.Variant.of;

/**
 * Operations with a {@code STRING} left operand: comparison in the
 * lexicographic order of {@link String#compareTo(String)} and
 * concatenation.
 */
@SuppressWarnings(value = {"unused"})
class StringOperations extends Operations {

    StringOperations() { super(Variant.Type.STRING, String.class, lookup()); }

    // @formatter:off
    private static Variant eq(String v, String w) { return of(v.equals(w)); }
    private static Variant ne(String v, String w)
        { return of(!v.equals(w)); }
    private static Variant lt(String v, String w)
        { return of(v.compareTo(w) < 0); }
    private static Variant le(String v, String w)
        { return of(v.compareTo(w) <= 0); }
    private static Variant gt(String v, String w)
        { return of(v.compareTo(w) > 0); }
    private static Variant ge(String v, String w)
        { return of(v.compareTo(w) >= 0); }

    private static Variant add(String v, String w) { return of(v.concat(w)); }
    // @formatter:on
}
