// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.reflect;

import java.util.Map;
import java.util.function.Supplier;

import uk.co.farowl.meta.support.ReflectionError;

/**
 * The descriptor of a class registered with a {@link ClassRegistry}:
 * its name, its parent, whether it may be instantiated, and its method
 * and property bindings by name. Descriptors form a tree rooted at a
 * single class without a parent (normally {@code meta.Object}). A
 * {@code MetaClass} does not change once registered.
 */
public final class MetaClass {

    private final String name;
    private final MetaClass parent;
    private final Class<?> javaClass;
    private final Supplier<?> factory;
    private final Map<String, MethodBinding> methods;
    private final Map<String, PropertyBinding> properties;

    /**
     * Create the descriptor from a frozen specification and the
     * bindings exposed from it.
     *
     * @param spec of the class
     * @param exposer having exposed the bindings
     */
    MetaClass(ClassSpec spec, ClassExposer exposer) {
        this.name = spec.getName();
        this.parent = spec.getParent();
        this.javaClass = spec.getJavaClass();
        this.factory = spec.getFactory();
        this.methods = exposer.getMethods();
        this.properties = exposer.getProperties();
    }

    /** @return the qualified name of the class */
    public String getName() { return name; }

    /** @return the parent class or {@code null} if this is a root */
    public MetaClass getParent() { return parent; }

    /** @return the Java class described */
    public Class<?> getJavaClass() { return javaClass; }

    /**
     * Whether instances may be created through {@link #instantiate()}.
     * This is the case when the specification supplied a factory.
     *
     * @return {@code true} iff instantiatable
     */
    public boolean isInstantiatable() { return factory != null; }

    /**
     * Create an instance through the factory of the class.
     *
     * @return the new instance
     * @throws ReflectionError if the class is not instantiatable
     */
    public Object instantiate() throws ReflectionError {
        if (factory == null) {
            throw ReflectionError.inClass(name,
                    "cannot instantiate: no factory");
        }
        return factory.get();
    }

    /**
     * Whether this is a strict ancestor of the other class.
     *
     * @param other class to test
     * @return {@code true} iff this is an ancestor of {@code other}
     */
    public boolean isParentOf(MetaClass other) {
        return other != null && other.isChildOf(this);
    }

    /**
     * Whether this is a strict descendant of the other class.
     *
     * @param other class to test
     * @return {@code true} iff this is a descendant of {@code other}
     */
    public boolean isChildOf(MetaClass other) {
        for (MetaClass c = parent; c != null; c = c.parent) {
            if (c == other) { return true; }
        }
        return false;
    }

    /**
     * Get a method defined by this class (not inherited).
     *
     * @param methodName exposed name
     * @return the method or {@code null}
     */
    public MethodBinding getMethod(String methodName) {
        return methods.get(methodName);
    }

    /**
     * Find a method defined by this class or, failing that, by the
     * nearest ancestor that defines one of that name.
     *
     * @param methodName exposed name
     * @return the method or {@code null}
     */
    public MethodBinding findMethod(String methodName) {
        for (MetaClass c = this; c != null; c = c.parent) {
            MethodBinding m = c.methods.get(methodName);
            if (m != null) { return m; }
        }
        return null;
    }

    /**
     * Get a property defined by this class (not inherited).
     *
     * @param propertyName exposed name
     * @return the property or {@code null}
     */
    public PropertyBinding getProperty(String propertyName) {
        return properties.get(propertyName);
    }

    /**
     * Find a property defined by this class or, failing that, by the
     * nearest ancestor that defines one of that name.
     *
     * @param propertyName exposed name
     * @return the property or {@code null}
     */
    public PropertyBinding findProperty(String propertyName) {
        for (MetaClass c = this; c != null; c = c.parent) {
            PropertyBinding p = c.properties.get(propertyName);
            if (p != null) { return p; }
        }
        return null;
    }

    /** @return the methods of this class (not inherited) in name order */
    public Map<String, MethodBinding> getMethods() { return methods; }

    /** @return the properties of this class (not inherited) */
    public Map<String, PropertyBinding> getProperties() {
        return properties;
    }

    @Override
    public String toString() { return "<class '" + name + "'>"; }
}
