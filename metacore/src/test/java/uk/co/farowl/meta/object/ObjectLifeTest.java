// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.object;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import uk.co.farowl.meta.support.ReflectionError;
import uk.co.farowl.meta.variant.Variant;

/**
 * Test the identity and life cycle of objects: issue and retirement of
 * {@link InstanceId}s by the {@link ObjectDB}, and the two ways an
 * object may be released.
 */
@DisplayName("Object life")
class ObjectLifeTest {

    static class Manual extends ManualObject {
        int destroyCalls;

        @Override
        protected void onDestroy() { destroyCalls++; }
    }

    static class Counted extends ReferencedObject {
        int releaseCalls;

        @Override
        protected void onRelease() { releaseCalls++; }
    }

    /** Its constructor may fail after the object is entered. */
    static class Fragile extends ManualObject {
        static Fragile last;

        Fragile(boolean fail) {
            last = this;
            if (fail) { throw new IllegalArgumentException("fragile"); }
        }
    }

    @Nested
    @DisplayName("in the object database")
    class Database {

        @Test
        void held_until_released() {
            int before = ObjectDB.size();
            assertThrows(IllegalArgumentException.class,
                    () -> new Fragile(true));
            // The failed object is still entered until released
            Fragile f = Fragile.last;
            assertTrue(f.isAlive());
            assertSame(f, ObjectDB.get(f.getInstanceId()));
            assertEquals(before + 1, ObjectDB.size());
            f.destroy();
            assertFalse(f.isAlive());
            assertEquals(before, ObjectDB.size());
        }

        @Test
        void new_object_is_alive() {
            Manual m = new Manual();
            InstanceId id = m.getInstanceId();
            assertTrue(id.isValid());
            assertTrue(ObjectDB.isAlive(id));
            assertSame(m, ObjectDB.get(id));
            m.destroy();
        }

        @Test
        void released_id_is_stale() {
            Manual m = new Manual();
            InstanceId id = m.getInstanceId();
            m.destroy();
            assertFalse(id.isValid());
            assertNull(ObjectDB.get(id));
        }

        @Test
        void reused_slot_has_new_generation() {
            Manual m = new Manual();
            InstanceId old = m.getInstanceId();
            m.destroy();
            // The vacated slot is the next one issued
            Manual n = new Manual();
            InstanceId id = n.getInstanceId();
            assertEquals(old.slot, id.slot);
            assertNotEquals(old, id);
            assertFalse(old.isValid());
            assertTrue(id.isValid());
            n.destroy();
        }

        @Test
        void table_grows() {
            int before = ObjectDB.size();
            List<Manual> many = new ArrayList<>();
            for (int i = 0; i < 200; i++) { many.add(new Manual()); }
            assertEquals(before + 200, ObjectDB.size());
            for (Manual m : many) {
                assertTrue(m.isAlive());
                m.destroy();
            }
            assertEquals(before, ObjectDB.size());
        }

        @Test
        void cannot_remove_twice() {
            Manual m = new Manual();
            InstanceId id = m.getInstanceId();
            ObjectDB.remove(id);
            assertThrows(ReflectionError.class, () -> ObjectDB.remove(id));
        }

        @Test
        void none_is_never_valid() {
            assertFalse(InstanceId.NONE.isValid());
            assertSame(InstanceId.NONE, Variant.of(1).getInstanceId());
        }
    }

    @Nested
    @DisplayName("of a manual object")
    class Manually {

        @Test
        void destroy_releases() {
            Manual m = new Manual();
            Variant v = Variant.of(m);
            m.destroy();
            assertEquals(1, m.destroyCalls);
            assertFalse(m.isAlive());
            assertTrue(v.isStale());
            assertNull(v.asObject());
        }

        @Test
        void destroy_twice_fails() {
            Manual m = new Manual();
            m.destroy();
            assertThrows(IllegalStateException.class, m::destroy);
            assertEquals(1, m.destroyCalls);
        }

        @Test
        void class_is_inherited() {
            Manual m = new Manual();
            assertSame(ManualObject.META, m.getMetaClass());
            assertEquals("meta.ManualObject", m.getClassName());
            m.destroy();
        }
    }

    @Nested
    @DisplayName("of a referenced object")
    class Referenced {

        @Test
        void starts_with_one_reference() {
            Counted c = new Counted();
            assertEquals(1, c.getReferenceCount());
            assertTrue(c.unreference());
            assertFalse(c.isAlive());
            assertEquals(1, c.releaseCalls);
        }

        @Test
        void released_at_zero() {
            Counted c = new Counted();
            c.reference();
            c.reference();
            assertEquals(3, c.getReferenceCount());
            assertFalse(c.unreference());
            assertFalse(c.unreference());
            assertTrue(c.isAlive());
            assertEquals(0, c.releaseCalls);
            assertTrue(c.unreference());
            assertFalse(c.isAlive());
            assertEquals(1, c.releaseCalls);
        }

        @Test
        void no_references_after_release() {
            Counted c = new Counted();
            c.unreference();
            assertThrows(IllegalStateException.class, c::reference);
            assertThrows(IllegalStateException.class, c::unreference);
            assertEquals(0, c.getReferenceCount());
        }

        @Test
        void class_is_inherited() {
            Counted c = new Counted();
            assertSame(ReferencedObject.META, c.getMetaClass());
            c.unreference();
        }
    }
}
