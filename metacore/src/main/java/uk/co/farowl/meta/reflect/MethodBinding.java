// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.reflect;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.invoke.MethodType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.meta.object.MetaObject;
import uk.co.farowl.meta.reflect.internal.Clinic;
import uk.co.farowl.meta.support.ReflectionError;
import uk.co.farowl.meta.variant.Variant;

/**
 * A type-erased wrapper around a Java method, static or instance, that
 * may be invoked with an array of {@link Variant} arguments to produce
 * a {@code Variant} result. The binding records the names and types of
 * the parameters, and the default values of a trailing sequence of
 * them, so that a caller may supply fewer arguments than there are
 * parameters.
 * <p>
 * The Java method is held as a {@code MethodHandle} adapted at
 * construction time by {@link Clinic}, so that it accepts an array of
 * {@code Variant} (and an {@code Object} receiver if it is an instance
 * method) and returns a {@code Variant}. Arguments convert to the Java
 * parameter types permissively: a value that cannot be converted
 * arrives as the zero value of the type.
 */
public abstract class MethodBinding {

    /** Logger for binding creation and rejected calls. */
    static final Logger logger =
            LoggerFactory.getLogger(MethodBinding.class);

    /** A parameter of the bound method. */
    public static final class Parameter {

        private final String name;
        private final Variant.Type type;
        private final Variant defaultValue;

        Parameter(String name, Variant.Type type, Variant defaultValue) {
            this.name = name;
            this.type = type;
            this.defaultValue = defaultValue;
        }

        /** @return name of the parameter */
        public String getName() { return name; }

        /**
         * The tag of values this parameter expects. {@code NULL} means
         * the method accepts a {@code Variant} of any type.
         *
         * @return type tag of the parameter
         */
        public Variant.Type getType() { return type; }

        /** @return the default value or {@code null} if there is none */
        public Variant getDefault() { return defaultValue; }

        /** @return whether there is a default value */
        public boolean hasDefault() { return defaultValue != null; }

        @Override
        public String toString() {
            String s = name + ": " + type;
            return hasDefault() ? s + " = " + defaultValue : s;
        }
    }

    /** Name of the Java method bound. */
    protected final String name;

    /** Class that declares the Java method. */
    protected final Class<?> declaringClass;

    /** Parameters in declaration order. */
    protected final List<Parameter> parameters;

    /** Defaults of the trailing parameters that have them. */
    protected final List<Variant> defaults;

    /** Tag of the value returned ({@code NULL} for any or none). */
    protected final Variant.Type returnType;

    /**
     * Handle on the Java method adapted to {@code Variant} arguments
     * and return, with the arguments collected into an array.
     */
    protected final MethodHandle handle;

    private MethodBinding(Method method, List<Parameter> parameters,
            MethodHandle handle) {
        this.name = method.getName();
        this.declaringClass = method.getDeclaringClass();
        this.parameters = Collections.unmodifiableList(parameters);
        List<Variant> d = new ArrayList<>();
        for (Parameter p : parameters) {
            if (p.hasDefault()) { d.add(p.defaultValue); }
        }
        this.defaults = Collections.unmodifiableList(d);
        this.returnType = Clinic.variantType(method.getReturnType());
        this.handle = handle;
    }

    // Construction --------------------------------------------------

    /**
     * Create a binding to the given method, taking the parameter names
     * and defaults from annotations on the parameters.
     *
     * @param lookup with access to the method
     * @param method to bind
     * @return the binding
     * @throws ReflectionError if the method cannot be bound
     */
    public static MethodBinding of(Lookup lookup, Method method)
            throws ReflectionError {
        return of(lookup, method, null, null);
    }

    /**
     * Create a binding to the given method with explicit parameter
     * names and defaults. A {@code null} or empty list means the names
     * (or defaults) are taken from annotations on the parameters. The
     * defaults, if given, apply to the last parameters.
     *
     * @param lookup with access to the method
     * @param method to bind
     * @param names of all the parameters (or {@code null})
     * @param defaults of the trailing parameters (or {@code null})
     * @return the binding
     * @throws ReflectionError if the method cannot be bound
     */
    public static MethodBinding of(Lookup lookup, Method method,
            List<String> names, List<Variant> defaults)
            throws ReflectionError {

        java.lang.reflect.Parameter[] jp = method.getParameters();
        final int n = jp.length;

        if (names != null && !names.isEmpty() && names.size() != n) {
            throw bindingError(method, "%d names given for %d parameters",
                    names.size(), n);
        } else if (defaults != null && defaults.size() > n) {
            throw bindingError(method,
                    "%d defaults given for %d parameters", defaults.size(),
                    n);
        }

        boolean explicitDefaults = defaults != null && !defaults.isEmpty();
        int firstDefault = explicitDefaults ? n - defaults.size() : n;
        List<Parameter> parameters = new ArrayList<>(n);

        for (int i = 0; i < n; i++) {
            java.lang.reflect.Parameter p = jp[i];
            Variant.Type type = Clinic.variantType(p.getType());

            // Name from list, or annotation, or as compiled
            String pname;
            Exposed.Name a = p.getAnnotation(Exposed.Name.class);
            if (names != null && !names.isEmpty()) {
                pname = names.get(i);
            } else if (a != null) {
                pname = a.value();
            } else {
                pname = p.getName();
            }

            // Default from list, or annotation text
            Variant dflt = null;
            if (explicitDefaults) {
                if (i >= firstDefault) {
                    dflt = defaults.get(i - firstDefault);
                }
            } else {
                Exposed.Default d = p.getAnnotation(Exposed.Default.class);
                if (d != null) {
                    dflt = Variant.parse(d.value(), type);
                    if (i < firstDefault) { firstDefault = i; }
                } else if (firstDefault < n) {
                    throw bindingError(method,
                            "parameter '%s' without default follows one "
                                    + "with a default",
                            pname);
                }
            }
            parameters.add(new Parameter(pname, type, dflt));
        }

        MethodHandle mh;
        try {
            mh = lookup.unreflect(method);
        } catch (IllegalAccessException e) {
            throw new ReflectionError(e, "cannot access method %s",
                    method);
        }

        MethodBinding binding;
        if (Modifier.isStatic(method.getModifiers())) {
            binding = new Static(method, parameters, adapt(mh, 0, n));
        } else {
            boolean isConst = method.isAnnotationPresent(Exposed.Const.class);
            binding = new Instance(method, parameters, adapt(mh, 1, n),
                    isConst);
        }

        logger.atDebug().setMessage("Bound {}.{}").addArgument(
                () -> method.getDeclaringClass().getSimpleName())
                .addArgument(binding).log();
        return binding;
    }

    /**
     * Create a binding to the only method of the given name declared by
     * a class, taking parameter names and defaults from annotations.
     *
     * @param lookup with access to the method
     * @param klass declaring the method
     * @param javaName name of the method in Java
     * @return the binding
     * @throws ReflectionError if there is not exactly one such method,
     *     or it cannot be bound
     */
    public static MethodBinding of(Lookup lookup, Class<?> klass,
            String javaName) throws ReflectionError {
        return of(lookup, findMethod(klass, javaName));
    }

    /**
     * Find the only method of the given name declared by a class.
     * Overloading is not supported.
     *
     * @param klass declaring the method
     * @param javaName name of the method in Java
     * @return the method
     * @throws ReflectionError if there is not exactly one such method
     */
    static Method findMethod(Class<?> klass, String javaName)
            throws ReflectionError {
        Method found = null;
        for (Method m : klass.getDeclaredMethods()) {
            if (m.getName().equals(javaName) && !m.isSynthetic()) {
                if (found != null) {
                    throw new ReflectionError(
                            "ambiguous overloads of %s.%s",
                            klass.getSimpleName(), javaName);
                }
                found = m;
            }
        }
        if (found == null) {
            throw new ReflectionError("no method %s in %s", javaName,
                    klass.getName());
        }
        return found;
    }

    /**
     * Adapt a handle on the Java method so that the parameters from
     * {@code pos} onwards are {@code Variant}s collected into an array,
     * the receiver (if any) is {@code Object}, and the return is a
     * {@code Variant}.
     */
    private static MethodHandle adapt(MethodHandle mh, int pos, int n) {
        MethodType mt = mh.type();
        mh = MethodHandles.filterArguments(mh, pos,
                Clinic.argumentFilter(mt, pos));
        MethodHandle rf = Clinic.returnFilter(mt);
        if (rf != null) { mh = MethodHandles.filterReturnValue(mh, rf); }
        if (pos > 0) {
            mh = mh.asType(mh.type().changeParameterType(0, Object.class));
        }
        return mh.asSpreader(Variant[].class, n);
    }

    private static ReflectionError bindingError(Method method, String err,
            Object... args) {
        return new ReflectionError("%s while binding %s.%s",
                String.format(err, args),
                method.getDeclaringClass().getSimpleName(),
                method.getName());
    }

    // Attributes ----------------------------------------------------

    /** @return the name of the Java method bound */
    public String getName() { return name; }

    /** @return the class declaring the Java method */
    public Class<?> getDeclaringClass() { return declaringClass; }

    /**
     * Whether the method is static, that is, takes no receiver.
     *
     * @return {@code true} iff static
     */
    public abstract boolean isStatic();

    /**
     * Whether the method is an instance method declared
     * {@link Exposed.Const}, and so may not be used as a property
     * setter. Static methods are never {@code const}.
     *
     * @return {@code true} iff {@code const}
     */
    public abstract boolean isConst();

    /** @return the tag of the return type */
    public Variant.Type getReturnType() { return returnType; }

    /** @return the number of parameters declared */
    public int getArgumentCount() { return parameters.size(); }

    /** @return the parameters in order */
    public List<Parameter> getParameters() { return parameters; }

    /**
     * The defaults declared for the trailing parameters that have them,
     * in parameter order.
     *
     * @return the declared defaults
     */
    public List<Variant> getDefaults() { return defaults; }

    // Invocation ----------------------------------------------------

    /**
     * Invoke the method with the first {@code argCount} elements of
     * {@code args}, taking the remaining arguments from the last
     * elements of {@code defaults}. The method is not called if the
     * number of arguments is outside the range the defaults allow, or
     * if this is an instance method and the receiver is unsuitable.
     * Exceptions thrown by the method itself propagate to the caller.
     *
     * @param receiver the object on which to call an instance method
     *     (ignored if the method is static)
     * @param args arguments (a {@code null} element means
     *     {@link Variant#NULL})
     * @param argCount number of elements of {@code args} to use
     * @param defaults for the trailing parameters
     * @return the outcome and the value returned
     * @throws Throwable from the method called
     */
    public Invocation invoke(Object receiver, Variant[] args, int argCount,
            List<Variant> defaults) throws Throwable {
        Variant[] argv;
        try {
            argv = arguments(args, argCount, defaults);
        } catch (ArgumentError ae) {
            logger.atDebug().log("{}() {}", name, ae);
            return Invocation.rejected(InvokeStatus.ARGUMENT_COUNT_MISMATCH,
                    name + "() " + ae);
        }

        String problem = checkReceiver(receiver);
        if (problem != null) {
            logger.atDebug().log("{}(): {}", name, problem);
            return Invocation.rejected(InvokeStatus.INVALID_RECEIVER,
                    name + "(): " + problem);
        }

        return Invocation.ok(call(receiver, argv));
    }

    /**
     * Invoke the method with the given arguments, supplying the
     * defaults declared in this binding for any missing trailing
     * arguments.
     *
     * @param receiver the object on which to call an instance method
     *     (ignored if the method is static)
     * @param args arguments
     * @return the outcome and the value returned
     * @throws Throwable from the method called
     */
    public Invocation invoke(Object receiver, Variant... args)
            throws Throwable {
        return invoke(receiver, args, args.length, defaults);
    }

    /**
     * Form the complete argument array from those supplied and the
     * defaults.
     *
     * @param args supplied
     * @param argCount number of {@code args} to use
     * @param defaults for trailing parameters
     * @return the arguments to pass
     * @throws ArgumentError if the number is wrong
     */
    private Variant[] arguments(Variant[] args, int argCount,
            List<Variant> defaults) throws ArgumentError {
        final int n = parameters.size();
        final int nd = defaults == null ? 0 : defaults.size();
        final int min = Math.max(0, n - nd);
        if (argCount < min || argCount > n) {
            throw new ArgumentError(min, n, argCount);
        } else if (argCount > 0 && (args == null || args.length < argCount)) {
            throw new IllegalArgumentException(
                    "argCount exceeds the length of args");
        }

        Variant[] argv = new Variant[n];
        for (int i = 0; i < argCount; i++) {
            Variant a = args[i];
            argv[i] = a == null ? Variant.NULL : a;
        }
        // Defaults align with the end of the parameter list
        for (int i = argCount; i < n; i++) {
            argv[i] = defaults.get(nd - (n - i));
        }
        return argv;
    }

    /**
     * Check that the receiver is suitable for this method, returning a
     * description of the problem if not.
     *
     * @param receiver to check
     * @return {@code null} or the problem
     */
    abstract String checkReceiver(Object receiver);

    /**
     * Call the adapted handle.
     *
     * @param receiver of an instance method
     * @param argv arguments (all parameters)
     * @return the return from the method
     * @throws Throwable from the method called
     */
    abstract Variant call(Object receiver, Variant[] argv) throws Throwable;

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(", ", name + "(", ")");
        for (Parameter p : parameters) { sj.add(p.toString()); }
        String s = sj.toString() + " -> " + returnType;
        return isStatic() ? "static " + s : s;
    }

    /** Binding to a static method. */
    private static final class Static extends MethodBinding {

        Static(Method method, List<Parameter> parameters,
                MethodHandle handle) {
            super(method, parameters, handle);
        }

        @Override
        public boolean isStatic() { return true; }

        @Override
        public boolean isConst() { return false; }

        @Override
        String checkReceiver(Object receiver) { return null; }

        @Override
        Variant call(Object receiver, Variant[] argv) throws Throwable {
            return (Variant)handle.invokeExact(argv);
        }
    }

    /** Binding to an instance method. */
    private static final class Instance extends MethodBinding {

        private final boolean isConst;

        Instance(Method method, List<Parameter> parameters,
                MethodHandle handle, boolean isConst) {
            super(method, parameters, handle);
            this.isConst = isConst;
        }

        @Override
        public boolean isStatic() { return false; }

        @Override
        public boolean isConst() { return isConst; }

        @Override
        String checkReceiver(Object receiver) {
            if (receiver == null) {
                return "receiver required";
            } else if (!declaringClass.isInstance(receiver)) {
                return String.format("receiver must be %s not %s",
                        declaringClass.getSimpleName(),
                        receiver.getClass().getSimpleName());
            } else if (receiver instanceof MetaObject
                    && !((MetaObject)receiver).isAlive()) {
                return "receiver has been released";
            }
            return null;
        }

        @Override
        Variant call(Object receiver, Variant[] argv) throws Throwable {
            return (Variant)handle.invokeExact(receiver, argv);
        }

        @Override
        public String toString() {
            return isConst ? super.toString() + " const" : super.toString();
        }
    }
}
