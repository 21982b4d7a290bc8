// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.reflect;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.meta.support.ReflectionError;

/**
 * A registry of {@link MetaClass}es by qualified name, and by the Java
 * class each describes. Classes are added by {@link #register(ClassSpec)},
 * normally from the static initialisation of the Java class, and are
 * never removed.
 * <p>
 * In normal operation there is only one instance of this class, behind
 * the {@link Reflection} facade. Tests create others freely. Each
 * registry has exactly one root class (one without a parent), and every
 * other class must have its parent in the same registry.
 * <p>
 * The registry may be sealed when start-up is complete, after which
 * registration is an error and the registry is effectively read-only.
 */
public class ClassRegistry {

    /** Logger for registration. */
    static final Logger logger =
            LoggerFactory.getLogger(ClassRegistry.class);

    /** Classes by qualified name. */
    private final Map<String, MetaClass> byName =
            new ConcurrentHashMap<>();

    /** Classes by the Java class they describe. */
    private final Map<Class<?>, MetaClass> byJavaClass =
            new ConcurrentHashMap<>();

    /**
     * Cache of the answers from {@link #forJavaClass(Class)}, which for
     * an unregistered Java class is the descriptor of its nearest
     * registered superclass. A registration may change the answer for
     * any subclass of the class registered, so each registration
     * replaces the cache with an empty one.
     */
    private volatile ClassValue<MetaClass> resolved = newCache();

    /** The class without a parent. */
    private volatile MetaClass root;

    /** Whether registration is closed. */
    private volatile boolean sealed;

    /**
     * Create a class from its specification and add it to the
     * registry. The specification is frozen.
     *
     * @param spec of the class
     * @return the new descriptor
     * @throws ReflectionError if the name or Java class is already
     *     registered, the parent is not suitable, the registry is
     *     sealed, or the specification is inconsistent
     */
    public MetaClass register(ClassSpec spec) throws ReflectionError {
        spec.freeze();
        String name = spec.getName();
        Class<?> javaClass = spec.getJavaClass();
        MetaClass mc;

        synchronized (this) {
            checkRegistrable(spec);
            mc = new MetaClass(spec, new ClassExposer(spec).expose());
            byName.put(name, mc);
            byJavaClass.put(javaClass, mc);
            if (mc.getParent() == null) { root = mc; }
            // Answers given before this registration may now be wrong
            resolved = newCache();
        }

        logger.atDebug().setMessage("Registered {} for {}").addArgument(mc)
                .addArgument(javaClass::getName).log();
        return mc;
    }

    /**
     * Check that the class is not already registered, that it has a
     * suitable parent and that the registry is open.
     *
     * @param spec of the class
     * @throws ReflectionError if not
     */
    private void checkRegistrable(ClassSpec spec) throws ReflectionError {
        String name = spec.getName();
        Class<?> javaClass = spec.getJavaClass();
        MetaClass parent = spec.getParent();

        if (sealed) {
            throw ReflectionError.inClass(name,
                    "cannot register when the registry is sealed");
        } else if (byName.containsKey(name)) {
            throw ReflectionError.inClass(name, "already registered");
        } else if (byJavaClass.containsKey(javaClass)) {
            throw ReflectionError.inClass(name,
                    "Java class %s is already registered as '%s'",
                    javaClass.getName(),
                    byJavaClass.get(javaClass).getName());
        }

        if (parent == null) {
            if (root != null) {
                throw ReflectionError.inClass(name,
                        "no parent given but '%s' is already the root",
                        root.getName());
            }
        } else if (byName.get(parent.getName()) != parent) {
            throw ReflectionError.inClass(name,
                    "parent '%s' is not in this registry",
                    parent.getName());
        } else if (!parent.getJavaClass().isAssignableFrom(javaClass)) {
            throw ReflectionError.inClass(name,
                    "Java class %s does not extend %s of parent '%s'",
                    javaClass.getName(), parent.getJavaClass().getName(),
                    parent.getName());
        }
    }

    /**
     * Find a class by its qualified name.
     *
     * @param name of the class
     * @return the class or {@code null} if it is not registered
     */
    public MetaClass findClass(String name) {
        return name == null ? null : byName.get(name);
    }

    /**
     * Test whether a class of the given name is registered.
     *
     * @param name of the class
     * @return {@code true} iff registered
     */
    public boolean classExists(String name) { return findClass(name) != null; }

    /**
     * Find the class that describes instances of the given Java class.
     * The Java class is statically initialised first, since that is
     * where it would register itself. If it is not itself registered,
     * the answer is the descriptor of its nearest registered Java
     * superclass.
     *
     * @param c Java class of an instance
     * @return the descriptor or {@code null} if there is none
     */
    public MetaClass forJavaClass(Class<?> c) { return resolved.get(c); }

    private ClassValue<MetaClass> newCache() {
        return new ClassValue<>() {
            @Override
            protected MetaClass computeValue(Class<?> c) {
                return resolve(c);
            }
        };
    }

    private MetaClass resolve(Class<?> c) {
        ensureInit(c);
        for (Class<?> k = c; k != null; k = k.getSuperclass()) {
            MetaClass mc = byJavaClass.get(k);
            if (mc != null) { return mc; }
        }
        return null;
    }

    /** @return the root class or {@code null} if not yet registered */
    public MetaClass getRoot() { return root; }

    /** @return all classes registered, in no particular order */
    public Collection<MetaClass> classes() {
        return Collections.unmodifiableCollection(byName.values());
    }

    /** Close the registry to further registration. */
    public synchronized void seal() {
        if (!sealed) {
            sealed = true;
            logger.atInfo().log("Registry sealed with {} classes",
                    byName.size());
        }
    }

    /** @return whether the registry is closed to registration */
    public boolean isSealed() { return sealed; }

    /**
     * Ensure a class is statically initialised. Static initialisation
     * of a class that registers itself will normally create its
     * {@link MetaClass} through a call to
     * {@link Reflection#register(ClassSpec)}.
     *
     * @param c to initialise
     */
    static void ensureInit(Class<?> c) {
        if (!c.isPrimitive() && !c.isArray()) {
            String name = c.getName();
            try {
                Class.forName(name, true, c.getClassLoader());
            } catch (ClassNotFoundException e) {
                throw new ReflectionError(e,
                        "failed to initialise class %s", name);
            }
        }
    }
}
