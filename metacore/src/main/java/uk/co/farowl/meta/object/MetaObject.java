// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.object;

import java.lang.invoke.MethodHandles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.meta.reflect.ClassSpec;
import uk.co.farowl.meta.reflect.Exposed;
import uk.co.farowl.meta.reflect.MetaClass;
import uk.co.farowl.meta.reflect.Reflection;

/**
 * The root of the registered class hierarchy. Every {@code MetaObject}
 * is entered in the {@link ObjectDB} when constructed, and so has an
 * {@link InstanceId} by which a {@code Variant} or a method binding
 * can tell whether it is still alive. How an object comes to be
 * released is the business of the sub-class: see {@link ManualObject}
 * and {@link ReferencedObject}.
 * <p>
 * The database holds a strong reference to each object from the moment
 * this constructor completes until the object is released. The Java
 * garbage collector will not reclaim an object that is never destroyed
 * or unreferenced, whether or not the program still refers to it. This
 * includes an object whose sub-class constructor throws after this
 * constructor has run: such a class should do its fallible work before
 * calling {@code super()}, in a static factory, or release the object
 * itself on the failure path.
 */
public abstract class MetaObject {

    /** Logger for object life cycle events. */
    static final Logger logger = LoggerFactory.getLogger(MetaObject.class);

    /** The class {@code meta.Object}: the root of the registry. */
    public static final MetaClass META = Reflection
            .register(new ClassSpec("meta.Object", MethodHandles.lookup()));

    private final InstanceId id;

    /**
     * Enter this object in the object database, where it stays until
     * released.
     */
    protected MetaObject() { this.id = ObjectDB.add(this); }

    /** @return the identity of this object */
    public final InstanceId getInstanceId() { return id; }

    /**
     * Whether the object has not yet been released.
     *
     * @return {@code true} iff alive
     */
    @Exposed.JavaMethod("IsAlive")
    @Exposed.Const
    public final boolean isAlive() { return id.isValid(); }

    /**
     * The registered class of this object, which is that of the nearest
     * registered Java class (this one or a superclass).
     *
     * @return the class of this object
     */
    public MetaClass getMetaClass() { return Reflection.classOf(getClass()); }

    /**
     * The name of the registered class of this object.
     *
     * @return qualified name of the class
     */
    @Exposed.JavaMethod("GetClassName")
    @Exposed.Const
    public String getClassName() {
        MetaClass mc = getMetaClass();
        return mc != null ? mc.getName() : getClass().getName();
    }

    /**
     * Remove the object from the database, so that references to it
     * become stale.
     */
    void release() {
        ObjectDB.remove(id);
        logger.atDebug().log("Released {} {}", getClass().getSimpleName(),
                id);
    }

    @Override
    public String toString() {
        return String.format("<%s object %s>", getClassName(), id);
    }
}
