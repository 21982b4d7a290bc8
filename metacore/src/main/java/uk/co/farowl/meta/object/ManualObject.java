// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.object;

import java.lang.invoke.MethodHandles;

import uk.co.farowl.meta.reflect.ClassSpec;
import uk.co.farowl.meta.reflect.Exposed;
import uk.co.farowl.meta.reflect.MetaClass;
import uk.co.farowl.meta.reflect.Reflection;

/**
 * An object whose life ends by an explicit call to {@link #destroy()}.
 * References to it then become stale.
 */
public abstract class ManualObject extends MetaObject {

    /** The class {@code meta.ManualObject}. */
    public static final MetaClass META = Reflection.register(
            new ClassSpec("meta.ManualObject", MethodHandles.lookup())
                    .parent(MetaObject.META));

    /** Construct a live object. */
    protected ManualObject() {}

    /**
     * End the life of this object. {@link #onDestroy()} is called
     * first.
     *
     * @throws IllegalStateException if already destroyed
     */
    @Exposed.JavaMethod("Destroy")
    public void destroy() throws IllegalStateException {
        if (!isAlive()) {
            throw new IllegalStateException(
                    "object " + getInstanceId() + " already destroyed");
        }
        onDestroy();
        release();
    }

    /** Called by {@link #destroy()} while the object is still alive. */
    protected void onDestroy() {}
}
