// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.reflect;

import java.lang.invoke.MethodHandles.Lookup;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

import uk.co.farowl.meta.support.ReflectionError;
import uk.co.farowl.meta.variant.Variant;

/**
 * A specification for a class to be registered through
 * {@link Reflection#register(ClassSpec)}. It is written as a chain of
 * calls that add features to the specification, typically in the
 * initialisation of a static field of the class being described:
 * <pre>
 * static final MetaClass META = Reflection.register(
 *         new ClassSpec("app.Bar", MethodHandles.lookup())
 *                 .parent(ManualObject.META)
 *                 .factory(Bar::new)
 *                 .method("SetStatic", "setStatic", List.of("value"),
 *                         List.of(Variant.of(114514)))
 *                 .property("Value", "Get", "Set"));
 * </pre>
 * The lookup object identifies the Java class being described, and
 * gives the registry the access it needs to create method handles on
 * its methods. Methods annotated in the class with
 * {@link Exposed.JavaMethod}, {@link Exposed.Getter} and
 * {@link Exposed.Setter} are added to those named in the
 * specification.
 * <p>
 * Once registered, a specification is frozen and further change is an
 * error.
 */
public class ClassSpec {

    /** Unmodifiable empty list. */
    private static final List<String> NONAMES = List.of();

    /**
     * A method to expose, named programmatically.
     *
     * @param name exposed name
     * @param javaName name of the Java method
     * @param argNames names of the parameters (may be empty)
     * @param defaults of trailing parameters (may be empty)
     */
    public static record MethodSpec(String name, String javaName,
            List<String> argNames, List<Variant> defaults) {}

    /**
     * A property to expose, naming its accessors among the exposed
     * methods of the class (or an ancestor).
     *
     * @param name exposed name
     * @param getter exposed name of the getter (or {@code null})
     * @param setter exposed name of the setter (or {@code null})
     */
    public static record PropertySpec(String name, String getter,
            String setter) {}

    /** Qualified name of the class. */
    private final String name;

    /** Access to the Java class and its members. */
    private final Lookup lookup;

    /** Registered parent (if not a root). */
    private MetaClass parent;

    /** Source of new instances (if instantiatable). */
    private Supplier<?> factory;

    /** Methods to expose, in order of specification. */
    private final List<MethodSpec> methods = new ArrayList<>();

    /** Properties to expose, in order of specification. */
    private final List<PropertySpec> properties = new ArrayList<>();

    /** Whether further change is allowed. */
    private boolean frozen;

    /**
     * Create (begin) a specification for a class.
     *
     * @param name qualified name of the class
     * @param lookup obtained in the Java class being described
     */
    public ClassSpec(String name, Lookup lookup) {
        this.name = name;
        this.lookup = lookup;
    }

    /**
     * Specify the parent class, which must already be registered.
     *
     * @param parent of the class
     * @return {@code this}
     */
    public ClassSpec parent(MetaClass parent) {
        checkNotFrozen();
        if (parent == null) {
            throw specError("parent is null (not yet registered?)");
        } else if (this.parent != null) { throw repeatError("parent"); }
        this.parent = parent;
        return this;
    }

    /**
     * Specify the means to create instances, making the class
     * instantiatable.
     *
     * @param factory of instances
     * @return {@code this}
     */
    public ClassSpec factory(Supplier<?> factory) {
        checkNotFrozen();
        if (this.factory != null) { throw repeatError("factory"); }
        this.factory = factory;
        return this;
    }

    /**
     * Expose a Java method of the class under the given name, with
     * parameter names and defaults as annotated or compiled.
     *
     * @param name to expose
     * @param javaName of the method
     * @return {@code this}
     */
    public ClassSpec method(String name, String javaName) {
        return method(name, javaName, NONAMES, List.of());
    }

    /**
     * Expose a Java method of the class under the given name, with
     * parameter names and defaults given explicitly. The defaults apply
     * to the last parameters of the method.
     *
     * @param name to expose
     * @param javaName of the method
     * @param argNames of all the parameters (or empty)
     * @param defaults of the trailing parameters (or empty)
     * @return {@code this}
     */
    public ClassSpec method(String name, String javaName,
            List<String> argNames, List<Variant> defaults) {
        checkNotFrozen();
        for (MethodSpec m : methods) {
            if (m.name().equals(name)) { throw repeatError("method", name); }
        }
        methods.add(new MethodSpec(name, javaName, List.copyOf(argNames),
                List.copyOf(defaults)));
        return this;
    }

    /**
     * Expose a property with the given accessors, which are named as
     * exposed methods.
     *
     * @param name to expose
     * @param getter exposed name of the getter (or {@code null})
     * @param setter exposed name of the setter (or {@code null})
     * @return {@code this}
     */
    public ClassSpec property(String name, String getter, String setter) {
        checkNotFrozen();
        for (PropertySpec p : properties) {
            if (p.name().equals(name)) {
                throw repeatError("property", name);
            }
        }
        if (getter == null && setter == null) {
            throw specError("property '%s' has no accessors", name);
        }
        properties.add(new PropertySpec(name, getter, setter));
        return this;
    }

    /**
     * Prevent further change and make some validity checks.
     *
     * @return {@code this}
     */
    ClassSpec freeze() {
        if (!frozen) {
            if (name == null || name.isEmpty()) {
                throw specError("class name missing");
            } else if (lookup == null) {
                throw specError("lookup missing");
            }
            frozen = true;
        }
        return this;
    }

    /** @return qualified name of the class */
    public String getName() { return name; }

    /** @return lookup given to the constructor */
    public Lookup getLookup() { return lookup; }

    /** @return the Java class described */
    public Class<?> getJavaClass() { return lookup.lookupClass(); }

    /** @return parent or {@code null} */
    public MetaClass getParent() { return parent; }

    /** @return factory or {@code null} */
    public Supplier<?> getFactory() { return factory; }

    /** @return programmatically specified methods */
    public List<MethodSpec> getMethods() {
        return Collections.unmodifiableList(methods);
    }

    /** @return programmatically specified properties */
    public List<PropertySpec> getProperties() {
        return Collections.unmodifiableList(properties);
    }

    /** Check that {@link #freeze()} has not yet been called. */
    private void checkNotFrozen() {
        if (frozen) { throw specError("specification changed after frozen"); }
    }

    /**
     * Construct a {@link ReflectionError} that names the class being
     * defined.
     *
     * @param err qualifying the error (a format string)
     * @param args to formatted message
     * @return to throw
     */
    ReflectionError specError(String err, Object... args) {
        return ReflectionError.inClass(name, err, args);
    }

    private ReflectionError repeatError(String thing) {
        return specError("repeat " + thing + " specified");
    }

    private ReflectionError repeatError(String method, String n) {
        return specError("repeat %s(\"%s\") specified", method, n);
    }

    @Override
    public String toString() {
        return String.format("ClassSpec[%s, parent=%s, %d methods]", name,
                parent == null ? null : parent.getName(), methods.size());
    }
}
