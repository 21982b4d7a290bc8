// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.reflect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.invoke.MethodHandles;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import uk.co.farowl.meta.object.ReferencedObject;
import uk.co.farowl.meta.support.ReflectionError;
import uk.co.farowl.meta.variant.Variant;
import uk.co.farowl.meta.variant.Variant.Type;

/** Test reading and writing properties through a {@link PropertyBinding}. */
@DisplayName("A property binding")
class PropertyBindingTest {

    /** Accessors from which to make properties. */
    static class Accessors {
        int count;

        @Exposed.Const
        int getCount() { return count; }

        void setCount(int count) { this.count = count; }

        @Exposed.Const
        void setConst(int count) {}

        void setText(String text) {}

        int withArg(int a) { return a; }

        static int getStatic() { return 3; }
    }

    private static MethodBinding bind(String javaName) {
        return MethodBinding.of(MethodHandles.lookup(), Accessors.class,
                javaName);
    }

    @Test
    void set_then_get() throws Throwable {
        PropertyBinding prop = Bar.META.getProperty("Value");
        assertEquals(Type.STRING, prop.getType());
        assertTrue(prop.isReadable());
        assertTrue(prop.isWritable());

        Bar obj = new Bar();
        String value = "I AM SB";
        prop.set(obj, Variant.of(value));
        assertEquals(value, obj.value);
        assertEquals(value, prop.get(obj).asString());
        obj.destroy();
    }

    @Test
    void read_only() throws Throwable {
        PropertyBinding prop =
                ReferencedObject.META.getProperty("ReferenceCount");
        assertEquals(Type.INT64, prop.getType());
        assertFalse(prop.isWritable());
        assertNull(prop.getSetter());

        Counted c = new Counted();
        assertEquals(1L, prop.get(c).asInt64());
        assertThrows(PropertyError.class,
                () -> prop.set(c, Variant.of(5)));
        c.unreference();
    }

    static class Counted extends ReferencedObject {}

    @Test
    void write_only() throws Throwable {
        PropertyBinding prop =
                new PropertyBinding("Count", null, bind("setCount"));
        assertEquals(Type.INT64, prop.getType());
        Accessors a = new Accessors();
        prop.set(a, Variant.of(12));
        assertEquals(12, a.count);
        assertThrows(PropertyError.class, () -> prop.get(a));
    }

    @Test
    void static_getter() throws Throwable {
        PropertyBinding prop =
                new PropertyBinding("Static", bind("getStatic"), null);
        assertEquals(Variant.of(3), prop.get(null));
    }

    @Test
    void rejected_receiver_is_an_error() {
        PropertyBinding prop = new PropertyBinding("Count",
                bind("getCount"), bind("setCount"));
        assertThrows(PropertyError.class, () -> prop.get("not Accessors"));
        assertThrows(PropertyError.class, () -> prop.set(null, Variant.of(1)));
    }

    @Test
    void released_receiver_is_an_error() {
        PropertyBinding prop = Bar.META.getProperty("Value");
        Bar obj = new Bar();
        obj.destroy();
        assertThrows(PropertyError.class,
                () -> prop.set(obj, Variant.of("x")));
    }

    @Test
    void inconsistent_definitions() {
        // No accessors
        assertThrows(ReflectionError.class,
                () -> new PropertyBinding("P", null, null));
        // Const setter
        assertThrows(ReflectionError.class,
                () -> new PropertyBinding("P", null, bind("setConst")));
        // Static setter
        assertThrows(ReflectionError.class,
                () -> new PropertyBinding("P", null, bind("getStatic")));
        // Getter with an argument
        assertThrows(ReflectionError.class,
                () -> new PropertyBinding("P", bind("withArg"), null));
        // Types differ
        assertThrows(ReflectionError.class, () -> new PropertyBinding("P",
                bind("getCount"), bind("setText")));
    }
}
