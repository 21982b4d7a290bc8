// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.object;

import java.lang.invoke.MethodHandles;
import java.util.concurrent.atomic.AtomicInteger;

import uk.co.farowl.meta.reflect.ClassSpec;
import uk.co.farowl.meta.reflect.Exposed;
import uk.co.farowl.meta.reflect.MetaClass;
import uk.co.farowl.meta.reflect.Reflection;

/**
 * An object whose life ends when the last reference to it is dropped.
 * A new object holds one reference, belonging to its creator. Each
 * {@link #reference()} adds one and each {@link #unreference()} drops
 * one. When the count reaches zero the object is released.
 */
public abstract class ReferencedObject extends MetaObject {

    /** The class {@code meta.ReferencedObject}. */
    public static final MetaClass META = Reflection.register(
            new ClassSpec("meta.ReferencedObject", MethodHandles.lookup())
                    .parent(MetaObject.META));

    private final AtomicInteger references = new AtomicInteger(1);

    /** Construct a live object holding one reference. */
    protected ReferencedObject() {}

    /**
     * Add a reference.
     *
     * @throws IllegalStateException if the object is already released
     */
    @Exposed.JavaMethod("Reference")
    public void reference() throws IllegalStateException {
        int n;
        do {
            n = references.get();
            if (n <= 0) { throw released(); }
        } while (!references.compareAndSet(n, n + 1));
    }

    /**
     * Drop a reference, releasing the object if it was the last.
     * {@link #onRelease()} is called before the object is released.
     *
     * @return {@code true} iff the object was released
     * @throws IllegalStateException if the object is already released
     */
    @Exposed.JavaMethod("Unreference")
    public boolean unreference() throws IllegalStateException {
        int n;
        do {
            n = references.get();
            if (n <= 0) { throw released(); }
        } while (!references.compareAndSet(n, n - 1));
        if (n == 1) {
            onRelease();
            release();
            return true;
        }
        return false;
    }

    /** @return number of references held */
    @Exposed.JavaMethod("GetReferenceCount")
    @Exposed.Getter("ReferenceCount")
    @Exposed.Const
    public int getReferenceCount() { return references.get(); }

    /** Called when the last reference is dropped. */
    protected void onRelease() {}

    private IllegalStateException released() {
        return new IllegalStateException(
                "object " + getInstanceId() + " already released");
    }
}
