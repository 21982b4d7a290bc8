// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.variant;

import static java.lang.invoke.MethodHandles.lookup;
import static uk.co.farowl.meta.variant.Variant.of;

import uk.co.farowl.meta.object.MetaObject;

/**
 * Operations with an {@code OBJECT} left operand. Object references are
 * equal only if they refer to the same object. Released objects may
 * still be compared.
 */
@SuppressWarnings(value = {"unused"})
class ObjectOperations extends Operations {

    ObjectOperations() {
        super(Variant.Type.OBJECT, MetaObject.class, lookup());
    }

    // @formatter:off
    private static Variant eq(MetaObject v, MetaObject w)
        { return of(v == w); }
    private static Variant ne(MetaObject v, MetaObject w)
        { return of(v != w); }
    // @formatter:on
}
