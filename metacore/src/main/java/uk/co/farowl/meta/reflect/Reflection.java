// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.reflect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.meta.object.ManualObject;
import uk.co.farowl.meta.object.MetaObject;
import uk.co.farowl.meta.object.ReferencedObject;
import uk.co.farowl.meta.support.ReflectionError;

/**
 * Static access to the {@link ClassRegistry} of the run time. Classes
 * register themselves here during their static initialisation, and
 * client code finds classes here by name or by Java class.
 * <p>
 * The built-in root classes ({@code meta.Object},
 * {@code meta.ManualObject} and {@code meta.ReferencedObject}) are
 * initialised before the first query, so they are always found. Any
 * other class is present once its Java class has been initialised.
 */
public final class Reflection {

    /** Logger for the registry as a whole. */
    static final Logger logger = LoggerFactory.getLogger(Reflection.class);

    /** The registry of the run time. */
    private static final ClassRegistry REGISTRY;

    static {
        logger.info("Meta-object registry waking up");
        REGISTRY = new ClassRegistry();
    }

    private Reflection() {} // no instances

    /**
     * Initialises the built-in classes, once, on first use. This is a
     * separate class so that a built-in class may register itself while
     * {@code Reflection} is being initialised, without the others being
     * initialised out of order.
     */
    private static final class BuiltIn {
        static {
            ClassRegistry.ensureInit(MetaObject.class);
            ClassRegistry.ensureInit(ManualObject.class);
            ClassRegistry.ensureInit(ReferencedObject.class);
        }

        static void ensure() {}
    }

    /**
     * Create a class from its specification and add it to the registry
     * of the run time.
     *
     * @param spec of the class
     * @return the new descriptor
     * @throws ReflectionError if the class cannot be registered
     */
    public static MetaClass register(ClassSpec spec) throws ReflectionError {
        return REGISTRY.register(spec);
    }

    /**
     * Find a class by its qualified name.
     *
     * @param name of the class
     * @return the class or {@code null} if it is not registered
     */
    public static MetaClass findClass(String name) {
        BuiltIn.ensure();
        return REGISTRY.findClass(name);
    }

    /**
     * Test whether a class of the given name is registered.
     *
     * @param name of the class
     * @return {@code true} iff registered
     */
    public static boolean classExists(String name) {
        BuiltIn.ensure();
        return REGISTRY.classExists(name);
    }

    /**
     * Find the class that describes instances of the given Java class.
     *
     * @param c Java class of an instance
     * @return the descriptor or {@code null}
     */
    public static MetaClass classOf(Class<?> c) {
        return REGISTRY.forJavaClass(c);
    }

    /** Close the registry of the run time to further registration. */
    public static void seal() {
        BuiltIn.ensure();
        REGISTRY.seal();
    }

    /** @return whether the registry is closed to registration */
    public static boolean isSealed() { return REGISTRY.isSealed(); }

    /** @return the registry of the run time */
    public static ClassRegistry registry() { return REGISTRY; }
}
