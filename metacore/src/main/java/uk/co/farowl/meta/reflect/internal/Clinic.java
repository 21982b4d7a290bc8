// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.reflect.internal;

import static java.lang.invoke.MethodType.methodType;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.invoke.MethodType;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.meta.object.MetaObject;
import uk.co.farowl.meta.support.ReflectionError;
import uk.co.farowl.meta.variant.Variant;

/**
 * {@code Clinic} is a collection of methods and {@code MethodHandle}s
 * for converting arguments and return values when calling a Java method
 * through a method binding. It lets classes exposed to the registry be
 * written in a natural way, using Java primitive and standard types.
 * The binding dresses the handle on each exposed method, using handles
 * from here as filters, so that every parameter is a {@link Variant}
 * and so is the return.
 * <p>
 * Conversion of arguments follows the "as" accessors of
 * {@code Variant} with a zero value as default, so it never fails: a
 * value that cannot be converted arrives as zero, {@code false} or
 * {@code null}.
 */
public class Clinic {

    /** Logger for argument wrapping actions. Mostly DEBUG level. */
    final static Logger logger = LoggerFactory.getLogger(Clinic.class);

    /** Lookup for resolving handles throughout the class. */
    private static final Lookup LOOKUP = MethodHandles.lookup();

    private static final Class<?> V = Variant.class;

    // Handles for converters from Variant to Java types for args
    private static final Map<Class<?>, MethodHandle> ARG_CONVERTERS;
    private static final MethodHandle objectArgMH;

    // Handles for converters from Java types to Variant for returns
    private static final MethodHandle voidValueMH;
    private static final MethodHandle boolValueMH;
    private static final MethodHandle int64ValueMH;
    private static final MethodHandle doubleValueMH;
    private static final MethodHandle stringValueMH;
    private static final MethodHandle objectValueMH;
    private static final MethodHandle boxedValueMH;

    static {
        try {
            MethodHandle asBool = arg("asBool", boolean.class, false);
            MethodHandle asByte = arg("asByte", byte.class, (byte)0);
            MethodHandle asInt16 = arg("asInt16", short.class, (short)0);
            MethodHandle asInt32 = arg("asInt32", int.class, 0);
            MethodHandle asInt64 = arg("asInt64", long.class, 0L);
            MethodHandle asFloat = arg("asFloat", float.class, 0.0f);
            MethodHandle asDouble = arg("asDouble", double.class, 0.0);

            ARG_CONVERTERS = Map.ofEntries(
                    Map.entry(boolean.class, asBool),
                    Map.entry(byte.class, asByte),
                    Map.entry(short.class, asInt16),
                    Map.entry(int.class, asInt32),
                    Map.entry(long.class, asInt64),
                    Map.entry(float.class, asFloat),
                    Map.entry(double.class, asDouble),
                    // Boxing is an asType conversion
                    Map.entry(Boolean.class, boxed(asBool, Boolean.class)),
                    Map.entry(Byte.class, boxed(asByte, Byte.class)),
                    Map.entry(Short.class, boxed(asInt16, Short.class)),
                    Map.entry(Integer.class, boxed(asInt32, Integer.class)),
                    Map.entry(Long.class, boxed(asInt64, Long.class)),
                    Map.entry(Float.class, boxed(asFloat, Float.class)),
                    Map.entry(Double.class, boxed(asDouble, Double.class)),
                    Map.entry(String.class,
                            arg("asString", String.class, null)));

            objectArgMH = LOOKUP.findVirtual(V, "asObject",
                    methodType(MetaObject.class, Class.class));

            voidValueMH = MethodHandles.constant(V, Variant.NULL);
            boolValueMH = LOOKUP.findStatic(V, "of",
                    methodType(V, boolean.class));
            int64ValueMH =
                    LOOKUP.findStatic(V, "of", methodType(V, long.class));
            doubleValueMH = LOOKUP.findStatic(V, "of",
                    methodType(V, double.class));
            stringValueMH = LOOKUP.findStatic(V, "of",
                    methodType(V, String.class));
            objectValueMH = LOOKUP.findStatic(V, "of",
                    methodType(V, MetaObject.class));
            boxedValueMH = LOOKUP.findStatic(V, "from",
                    methodType(V, Object.class));

            logger.atDebug().log("Conversions ready for {} Java types",
                    ARG_CONVERTERS.size());

        } catch (NoSuchMethodException | IllegalAccessException e) {
            // Handle lookup fails somewhere
            throw new ReflectionError(e, "Failed to initialise Clinic.");
        }
    }

    private Clinic() {} // Oh no you don't

    /**
     * Create an array of filters to convert an existing method handle,
     * with the given type, to one that expects a {@code Variant} at
     * every parameter from a given index onwards. The returned array is
     * suitable as an argument to {@code MethodHandles.filterArguments}.
     * (An element is {@code null} where the parameter is already a
     * {@code Variant}.)
     *
     * @param mt type to adapt.
     * @param pos index in the type at which to start.
     * @return array of filter-adaptors to expect {@code Variant}.
     * @throws ReflectionError if a parameter type is not supported
     */
    public static MethodHandle[] argumentFilter(MethodType mt, int pos)
            throws ReflectionError {
        final int n = mt.parameterCount() - pos;
        assert n >= 0;
        MethodHandle[] filter = new MethodHandle[n];
        for (int p = 0; p < n; p++) {
            Class<?> pt = mt.parameterType(pos + p);
            filter[p] = adaptParameterToVariant(pt);
        }
        return filter;
    }

    /**
     * Return a filter that will adapt an existing method handle with
     * the given type, to one that returns {@code Variant}. If the
     * return type is {@code void}, the adapter takes no arguments and
     * produces {@link Variant#NULL}. If the return type is already
     * {@code Variant}, this method returns {@code null}, which is not
     * suitable as an argument to {@code filterReturnValue}. Client code
     * must test for this.
     *
     * @param mt type to adapt.
     * @return {@code null} or a filter-adapter to return
     *     {@code Variant}.
     * @throws ReflectionError if the return type is not supported
     */
    public static MethodHandle returnFilter(MethodType mt)
            throws ReflectionError {
        return adaptReturnToVariant(mt.returnType());
    }

    /**
     * The type tag under which a value of the given Java type travels
     * in a {@code Variant}. {@code void} and {@code Variant} itself are
     * {@code NULL}, meaning no value in the first case, and any value
     * in the second.
     *
     * @param c Java type of a parameter or return
     * @return the corresponding tag
     * @throws ReflectionError if the type is not supported
     */
    public static Variant.Type variantType(Class<?> c)
            throws ReflectionError {
        if (c == boolean.class || c == Boolean.class) {
            return Variant.Type.BOOL;
        } else if (c == byte.class || c == short.class || c == int.class
                || c == long.class || c == Byte.class || c == Short.class
                || c == Integer.class || c == Long.class) {
            return Variant.Type.INT64;
        } else if (c == float.class || c == double.class
                || c == Float.class || c == Double.class) {
            return Variant.Type.DOUBLE;
        } else if (c == String.class) {
            return Variant.Type.STRING;
        } else if (MetaObject.class.isAssignableFrom(c)) {
            return Variant.Type.OBJECT;
        } else if (c == V || c == void.class) {
            return Variant.Type.NULL;
        }
        throw unsupported(c);
    }

    // Conversions to Java -------------------------------------------

    /**
     * The logic of this method defines the standard for converting a
     * {@code Variant} to a specified Java type.
     *
     * @param c Java type expected by the method
     * @return filter converting {@code Variant} to {@code c}.
     */
    private static MethodHandle adaptParameterToVariant(Class<?> c) {
        MethodHandle mh = ARG_CONVERTERS.get(c);
        if (mh != null) {
            return mh;
        } else if (c == V) {
            // The method expects exactly a Variant
            return null;
        } else if (MetaObject.class.isAssignableFrom(c)) {
            // asObject(c) then cast to c
            return MethodHandles.insertArguments(objectArgMH, 1, c)
                    .asType(methodType(c, V));
        }
        throw unsupported(c);
    }

    // Conversions from Java -----------------------------------------

    /**
     * The logic of this method defines the standard for converting
     * specified Java types to {@code Variant}.
     *
     * @param c Java type returned by the method
     * @return filter converting {@code c} to {@code Variant}.
     */
    private static MethodHandle adaptReturnToVariant(Class<?> c) {
        if (c.isPrimitive()) {
            if (c == void.class) {
                return voidValueMH;
            } else if (c == boolean.class) {
                return boolValueMH;
            } else if (c == float.class || c == double.class) {
                return doubleValueMH.asType(methodType(V, c));
            } else if (c != char.class) {
                // byte, short, int and long widen to long
                return int64ValueMH.asType(methodType(V, c));
            }
        } else if (c == V) {
            return null;
        } else if (c == String.class) {
            return stringValueMH;
        } else if (MetaObject.class.isAssignableFrom(c)) {
            return objectValueMH.asType(methodType(V, c));
        } else if (ARG_CONVERTERS.containsKey(c)) {
            // One of the boxed primitive types
            return boxedValueMH.asType(methodType(V, c));
        }
        throw unsupported(c);
    }

    // Helpers -------------------------------------------------------

    /**
     * A handle on the named "as" accessor of {@code Variant}, with its
     * default argument bound.
     */
    private static MethodHandle arg(String name, Class<?> type,
            Object defaultValue)
            throws NoSuchMethodException, IllegalAccessException {
        MethodHandle mh =
                LOOKUP.findVirtual(V, name, methodType(type, type));
        return MethodHandles.insertArguments(mh, 1, defaultValue);
    }

    private static MethodHandle boxed(MethodHandle mh, Class<?> box) {
        return mh.asType(methodType(box, V));
    }

    private static ReflectionError unsupported(Class<?> c) {
        return new ReflectionError(
                "Cannot convert between Variant and Java %s",
                c.getTypeName());
    }
}
