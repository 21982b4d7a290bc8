// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.reflect;

import uk.co.farowl.meta.support.ReflectionError;
import uk.co.farowl.meta.variant.Variant;

/**
 * A named property of a class, read through a getter and written
 * through a setter, each a {@link MethodBinding}. Either may be absent,
 * making the property write-only or read-only.
 */
public final class PropertyBinding {

    private final String name;
    private final MethodBinding getter;
    private final MethodBinding setter;

    /**
     * Create a property from its accessors. The getter must take no
     * arguments. The setter must be a non-{@link Exposed.Const} instance
     * method taking one argument, of the same type the getter returns.
     *
     * @param name of the property
     * @param getter or {@code null} if write-only
     * @param setter or {@code null} if read-only
     * @throws ReflectionError if the accessors are unsuitable
     */
    public PropertyBinding(String name, MethodBinding getter,
            MethodBinding setter) throws ReflectionError {
        this.name = name;
        this.getter = getter;
        this.setter = setter;

        if (getter == null && setter == null) {
            throw propertyError("neither getter nor setter");
        }
        if (getter != null && getter.getArgumentCount() != 0) {
            throw propertyError("getter %s takes arguments", getter);
        }
        if (setter != null) {
            if (setter.isStatic() || setter.isConst()) {
                throw propertyError(
                        "setter %s is not a mutating instance method",
                        setter);
            } else if (setter.getArgumentCount() != 1) {
                throw propertyError("setter %s must take one argument",
                        setter);
            } else if (getter != null && getter.getReturnType() != setter
                    .getParameters().get(0).getType()) {
                throw propertyError("getter and setter types differ");
            }
        }
    }

    private ReflectionError propertyError(String err, Object... args) {
        return new ReflectionError("%s in property '%s'",
                String.format(err, args), name);
    }

    /** @return the name of the property */
    public String getName() { return name; }

    /** @return the getter or {@code null} */
    public MethodBinding getGetter() { return getter; }

    /** @return the setter or {@code null} */
    public MethodBinding getSetter() { return setter; }

    /** @return whether there is a getter */
    public boolean isReadable() { return getter != null; }

    /** @return whether there is a setter */
    public boolean isWritable() { return setter != null; }

    /**
     * The type of the property: the return type of the getter or, if
     * there is no getter, the parameter type of the setter.
     *
     * @return the type tag
     */
    public Variant.Type getType() {
        return getter != null ? getter.getReturnType()
                : setter.getParameters().get(0).getType();
    }

    /**
     * Read the property.
     *
     * @param receiver whose property is read (ignored if the getter is
     *     static)
     * @return the value
     * @throws PropertyError if there is no getter or it rejects the
     *     call
     * @throws Throwable from the getter
     */
    public Variant get(Object receiver) throws PropertyError, Throwable {
        if (getter == null) {
            throw new PropertyError("property '%s' is write-only", name);
        }
        return check(getter.invoke(receiver)).getValue();
    }

    /**
     * Write the property.
     *
     * @param receiver whose property is written
     * @param value to write
     * @throws PropertyError if there is no setter or it rejects the
     *     call
     * @throws Throwable from the setter
     */
    public void set(Object receiver, Variant value)
            throws PropertyError, Throwable {
        if (setter == null) {
            throw new PropertyError("property '%s' is read-only", name);
        }
        check(setter.invoke(receiver, value));
    }

    private Invocation check(Invocation result) throws PropertyError {
        if (!result.isOK()) {
            throw new PropertyError("property '%s': %s", name,
                    result.getMessage());
        }
        return result;
    }

    @Override
    public String toString() {
        String access = getter == null ? "write-only"
                : setter == null ? "read-only" : "read-write";
        return String.format("%s: %s (%s)", name, getType(), access);
    }
}
