// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.reflect;

import java.lang.invoke.MethodHandles.Lookup;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.meta.reflect.ClassSpec.MethodSpec;
import uk.co.farowl.meta.reflect.ClassSpec.PropertySpec;
import uk.co.farowl.meta.support.ReflectionError;

/**
 * The exposer builds the method and property bindings of a class from
 * its {@link ClassSpec}. It scans the Java class for methods annotated
 * as {@link Exposed.JavaMethod}, {@link Exposed.Getter} or
 * {@link Exposed.Setter}, then adds the methods and properties named in
 * the specification. A name defined twice is an error.
 */
class ClassExposer {

    /** Logger for the exposure of classes. */
    static final Logger logger = LoggerFactory.getLogger(ClassExposer.class);

    private final ClassSpec spec;
    private final Lookup lookup;
    private final Class<?> javaClass;

    /** Methods by exposed name, in name order. */
    private final Map<String, MethodBinding> methods = new TreeMap<>();

    /** Properties by exposed name, in order of definition. */
    private final Map<String, PropertyBinding> properties =
            new LinkedHashMap<>();

    /**
     * Getter and setter found by annotation, by property name, in
     * order of discovery.
     */
    private final Map<String, MethodBinding[]> accessors =
            new LinkedHashMap<>();

    /**
     * Create an exposer for the class specified.
     *
     * @param spec of the class
     */
    ClassExposer(ClassSpec spec) {
        this.spec = spec;
        this.lookup = spec.getLookup();
        this.javaClass = spec.getJavaClass();
    }

    /**
     * Create all the method and property bindings of the class.
     *
     * @return {@code this}
     * @throws ReflectionError on an inconsistent definition
     */
    ClassExposer expose() throws ReflectionError {
        scanJavaMethods();
        for (MethodSpec ms : spec.getMethods()) { addSpecMethod(ms); }
        for (Map.Entry<String, MethodBinding[]> e : accessors.entrySet()) {
            MethodBinding[] gs = e.getValue();
            addProperty(new PropertyBinding(e.getKey(), gs[0], gs[1]));
        }
        for (PropertySpec ps : spec.getProperties()) {
            addProperty(new PropertyBinding(ps.name(),
                    resolveAccessor(ps.name(), ps.getter()),
                    resolveAccessor(ps.name(), ps.setter())));
        }
        logger.atDebug().log("Exposed {} methods and {} properties of {}",
                methods.size(), properties.size(), spec.getName());
        return this;
    }

    /** @return methods by exposed name, in name order */
    Map<String, MethodBinding> getMethods() {
        return Collections.unmodifiableMap(methods);
    }

    /** @return properties by exposed name, in order of definition */
    Map<String, PropertyBinding> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    /**
     * Scan the declared methods of the class for annotations. We sort
     * them by name because reflection returns them in no particular
     * order.
     */
    private void scanJavaMethods() {
        Method[] declared = javaClass.getDeclaredMethods();
        Arrays.sort(declared, Comparator.comparing(Method::getName));

        for (Method m : declared) {
            if (m.isSynthetic()) { continue; }
            Exposed.JavaMethod jm = m.getAnnotation(Exposed.JavaMethod.class);
            Exposed.Getter getter = m.getAnnotation(Exposed.Getter.class);
            Exposed.Setter setter = m.getAnnotation(Exposed.Setter.class);
            if (jm == null && getter == null && setter == null) {
                continue;
            }

            // One binding serves all the roles of this method
            MethodBinding binding = MethodBinding.of(lookup, m);

            if (jm != null) { addMethod(exposedName(jm.value(), m), binding); }
            if (getter != null) {
                addAccessor(exposedName(getter.value(), m), 0, binding);
            }
            if (setter != null) {
                addAccessor(exposedName(setter.value(), m), 1, binding);
            }
        }
    }

    private static String exposedName(String name, Method m) {
        return name.isEmpty() ? m.getName() : name;
    }

    private void addSpecMethod(MethodSpec ms) {
        Method m = MethodBinding.findMethod(javaClass, ms.javaName());
        addMethod(ms.name(),
                MethodBinding.of(lookup, m, ms.argNames(), ms.defaults()));
    }

    private void addMethod(String name, MethodBinding binding) {
        if (methods.putIfAbsent(name, binding) != null) {
            throw spec.specError("duplicate method '%s'", name);
        }
    }

    private void addAccessor(String name, int role, MethodBinding binding) {
        MethodBinding[] gs =
                accessors.computeIfAbsent(name, k -> new MethodBinding[2]);
        if (gs[role] != null) {
            throw spec.specError("duplicate %s for property '%s'",
                    role == 0 ? "getter" : "setter", name);
        }
        gs[role] = binding;
    }

    private void addProperty(PropertyBinding property) {
        if (properties.putIfAbsent(property.getName(), property) != null) {
            throw spec.specError("duplicate property '%s'",
                    property.getName());
        }
    }

    /**
     * Find the method named as an accessor of a property, first among
     * the methods of this class, then among those of its ancestors.
     *
     * @param property being defined
     * @param name exposed name of the method, or {@code null}
     * @return the binding or {@code null} if {@code name} is
     *     {@code null}
     */
    private MethodBinding resolveAccessor(String property, String name) {
        if (name == null) { return null; }
        MethodBinding binding = methods.get(name);
        MetaClass parent = spec.getParent();
        if (binding == null && parent != null) {
            binding = parent.findMethod(name);
        }
        if (binding == null) {
            throw spec.specError("no method '%s' for property '%s'", name,
                    property);
        }
        return binding;
    }
}
