// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.variant;

import uk.co.farowl.meta.object.InstanceId;
import uk.co.farowl.meta.object.MetaObject;
import uk.co.farowl.meta.support.ReflectionError;

/**
 * A dynamically-typed value that carries arguments and return values
 * across the reflection boundary. A {@code Variant} holds exactly one
 * value from a closed set of types, identified by its {@link Type} tag.
 * <p>
 * Instances are immutable. Copying a {@code Variant} that holds a
 * {@code String} or an object reference copies only the reference. An
 * object reference is held together with the {@link InstanceId} of the
 * object, so that a {@code Variant} may detect that the object has been
 * released, without itself keeping the object alive in any sense that
 * matters to the object layer.
 * <p>
 * The "as" accessors ({@link #asInt64(long)} etc.) convert the value on
 * a best-effort basis. When the stored type cannot produce the type
 * requested, the accessor returns the caller's default. This leniency
 * is deliberate: it is what makes default arguments and permissive
 * invocation through a {@code MethodBinding} work.
 */
public final class Variant {

    /** The types a {@code Variant} may hold. */
    public enum Type {
        /** No value. */
        NULL,
        /** A Java {@code boolean}. */
        BOOL,
        /** A 64-bit signed integer. */
        INT64,
        /** A 64-bit floating point number. */
        DOUBLE,
        /** A (non-null) Java {@code String}. */
        STRING,
        /** A reference to a {@link MetaObject}. */
        OBJECT;
    }

    /**
     * The operators that may be applied to {@code Variant}s through
     * {@link Variant#evaluate(Operator, Variant, Variant)}. Each has a
     * method name under which its implementations are declared in the
     * operations classes of each type.
     */
    public enum Operator {
        EQUAL("eq"), NOT_EQUAL("ne"), LESS("lt"), LESS_EQUAL("le"),
        GREATER("gt"), GREATER_EQUAL("ge"),

        ADD("add"), SUBTRACT("sub"), MULTIPLY("mul"), DIVIDE("div"),
        MOD("mod"), NEGATIVE("neg", true), POSITIVE("pos", true),

        AND("and"), OR("or"), XOR("xor"), NOT("not", true),

        BIT_AND("bitand"), BIT_OR("bitor"), BIT_XOR("bitxor"),
        BIT_FLIP("bitflip", true), SHIFT_LEFT("lshift"),
        SHIFT_RIGHT("rshift");

        /** Name of the implementing methods. */
        final String methodName;

        /** The operator takes only the left operand. */
        final boolean unary;

        private Operator(String methodName, boolean unary) {
            this.methodName = methodName;
            this.unary = unary;
        }

        private Operator(String methodName) { this(methodName, false); }

        /**
         * Whether the operator is unary. A unary operator ignores its
         * right operand.
         *
         * @return {@code true} iff unary
         */
        public boolean isUnary() { return unary; }
    }

    /** The {@code Variant} with no value. */
    public static final Variant NULL = new Variant(Type.NULL, 0L, null);

    /** The {@code Variant} holding {@code true}. */
    public static final Variant TRUE = new Variant(Type.BOOL, 1L, null);

    /** The {@code Variant} holding {@code false}. */
    public static final Variant FALSE = new Variant(Type.BOOL, 0L, null);

    /** An object reference together with the identity of the object. */
    private static final class ObjectData {
        final MetaObject object;
        final InstanceId id;

        ObjectData(MetaObject object, InstanceId id) {
            this.object = object;
            this.id = id;
        }
    }

    /** Type of the value held. */
    private final Type type;

    /**
     * Payload for {@code BOOL} (0 or 1), {@code INT64} (the value) and
     * {@code DOUBLE} (raw IEEE bits).
     */
    private final long bits;

    /**
     * Payload for {@code STRING} (a {@code String}) and {@code OBJECT}
     * (an {@link ObjectData}).
     */
    private final Object ref;

    private Variant(Type type, long bits, Object ref) {
        this.type = type;
        this.bits = bits;
        this.ref = ref;
    }

    // Construction --------------------------------------------------

    /**
     * Return a {@code BOOL} {@code Variant}.
     *
     * @param value to hold
     * @return {@link #TRUE} or {@link #FALSE}
     */
    public static Variant of(boolean value) { return value ? TRUE : FALSE; }

    /**
     * Return an {@code INT64} {@code Variant}. (Narrower Java integer
     * types widen to this.)
     *
     * @param value to hold
     * @return the {@code Variant}
     */
    public static Variant of(long value) {
        return new Variant(Type.INT64, value, null);
    }

    /**
     * Return a {@code DOUBLE} {@code Variant}. ({@code float} widens to
     * this.)
     *
     * @param value to hold
     * @return the {@code Variant}
     */
    public static Variant of(double value) {
        return new Variant(Type.DOUBLE, Double.doubleToRawLongBits(value),
                null);
    }

    /**
     * Return a {@code STRING} {@code Variant}, or {@link #NULL} if the
     * argument is {@code null}.
     *
     * @param value to hold
     * @return the {@code Variant}
     */
    public static Variant of(String value) {
        return value == null ? NULL : new Variant(Type.STRING, 0L, value);
    }

    /**
     * Return an {@code OBJECT} {@code Variant} referring to the given
     * object, or {@link #NULL} if the argument is {@code null}.
     *
     * @param value to refer to
     * @return the {@code Variant}
     */
    public static Variant of(MetaObject value) {
        if (value == null) { return NULL; }
        return new Variant(Type.OBJECT, 0L,
                new ObjectData(value, value.getInstanceId()));
    }

    /**
     * Return a {@code Variant} holding the value of a boxed Java object
     * of one of the supported types.
     *
     * @param o to convert
     * @return the {@code Variant}
     * @throws IllegalArgumentException if there is no conversion
     */
    public static Variant from(Object o) throws IllegalArgumentException {
        if (o == null) {
            return NULL;
        } else if (o instanceof Variant) {
            return (Variant)o;
        } else if (o instanceof Boolean) {
            return of(((Boolean)o).booleanValue());
        } else if (o instanceof Long || o instanceof Integer
                || o instanceof Short || o instanceof Byte) {
            return of(((Number)o).longValue());
        } else if (o instanceof Double || o instanceof Float) {
            return of(((Number)o).doubleValue());
        } else if (o instanceof CharSequence) {
            return of(o.toString());
        } else if (o instanceof MetaObject) {
            return of((MetaObject)o);
        }
        throw new IllegalArgumentException(String.format(
                "cannot make a Variant from %s", o.getClass().getName()));
    }

    /**
     * Parse text as a value of the given type. This is how the text of
     * a default given in an annotation becomes a {@code Variant}. Only
     * {@code "null"} is acceptable for {@code NULL} and {@code OBJECT}.
     *
     * @param text to parse
     * @param type required
     * @return the value parsed
     * @throws ReflectionError if the text is not a valid value
     */
    public static Variant parse(String text, Type type)
            throws ReflectionError {
        try {
            switch (type) {
                case BOOL:
                    if ("true".equals(text)) {
                        return TRUE;
                    } else if ("false".equals(text)) { return FALSE; }
                    break;
                case INT64:
                    return of(Long.parseLong(text.strip()));
                case DOUBLE:
                    return of(Double.parseDouble(text.strip()));
                case STRING:
                    return of(text);
                default:
                    if ("null".equals(text)) { return NULL; }
            }
        } catch (NumberFormatException e) {
            throw new ReflectionError(e, BAD_TEXT, text, type);
        }
        throw new ReflectionError(BAD_TEXT, text, type);
    }

    private static final String BAD_TEXT = "'%s' is not a valid %s";

    // Inspection ----------------------------------------------------

    /**
     * The type of value held.
     *
     * @return the type tag
     */
    public Type getType() { return type; }

    /**
     * Whether this is the {@code NULL} {@code Variant}.
     *
     * @return {@code true} iff the type is {@code NULL}
     */
    public boolean isNull() { return type == Type.NULL; }

    /**
     * Whether this holds a reference to an object that has since been
     * released.
     *
     * @return {@code true} iff an {@code OBJECT} that is no longer alive
     */
    public boolean isStale() {
        return type == Type.OBJECT && !((ObjectData)ref).id.isValid();
    }

    /**
     * The identity of the object referenced, or {@link InstanceId#NONE}
     * if this is not an {@code OBJECT}.
     *
     * @return identity of the object
     */
    public InstanceId getInstanceId() {
        return type == Type.OBJECT ? ((ObjectData)ref).id
                : InstanceId.NONE;
    }

    // Exact payload access for the operations classes.

    boolean boolValue() { return bits != 0L; }

    long int64Value() { return bits; }

    double doubleValue() { return Double.longBitsToDouble(bits); }

    String stringValue() { return (String)ref; }

    MetaObject objectValue() { return ((ObjectData)ref).object; }

    // Conversion ----------------------------------------------------

    /**
     * Return the value as a {@code boolean}, where numbers are true if
     * not zero.
     *
     * @param defaultValue if the type cannot convert
     * @return the converted value or {@code defaultValue}
     */
    public boolean asBool(boolean defaultValue) {
        switch (type) {
            case BOOL:
            case INT64:
                return bits != 0L;
            case DOUBLE:
                return doubleValue() != 0.0;
            default:
                return defaultValue;
        }
    }

    /**
     * Equivalent to {@code asBool(false)}.
     *
     * @return the converted value or {@code false}
     */
    public boolean asBool() { return asBool(false); }

    /**
     * Return the value as a {@code byte}, truncating as a Java cast
     * does.
     *
     * @param defaultValue if the type cannot convert
     * @return the converted value or {@code defaultValue}
     */
    public byte asByte(byte defaultValue) {
        switch (type) {
            case BOOL:
            case INT64:
                return (byte)bits;
            case DOUBLE:
                return (byte)doubleValue();
            default:
                return defaultValue;
        }
    }

    /**
     * Return the value as a {@code short}, truncating as a Java cast
     * does.
     *
     * @param defaultValue if the type cannot convert
     * @return the converted value or {@code defaultValue}
     */
    public short asInt16(short defaultValue) {
        switch (type) {
            case BOOL:
            case INT64:
                return (short)bits;
            case DOUBLE:
                return (short)doubleValue();
            default:
                return defaultValue;
        }
    }

    /**
     * Return the value as an {@code int}, truncating as a Java cast
     * does.
     *
     * @param defaultValue if the type cannot convert
     * @return the converted value or {@code defaultValue}
     */
    public int asInt32(int defaultValue) {
        switch (type) {
            case BOOL:
            case INT64:
                return (int)bits;
            case DOUBLE:
                return (int)doubleValue();
            default:
                return defaultValue;
        }
    }

    /**
     * Equivalent to {@code asInt32(0)}.
     *
     * @return the converted value or zero
     */
    public int asInt32() { return asInt32(0); }

    /**
     * Return the value as a {@code long}. A {@code DOUBLE} is truncated
     * towards zero and a {@code BOOL} is 1 or 0.
     *
     * @param defaultValue if the type cannot convert
     * @return the converted value or {@code defaultValue}
     */
    public long asInt64(long defaultValue) {
        switch (type) {
            case BOOL:
            case INT64:
                return bits;
            case DOUBLE:
                return (long)doubleValue();
            default:
                return defaultValue;
        }
    }

    /**
     * Equivalent to {@code asInt64(0L)}.
     *
     * @return the converted value or zero
     */
    public long asInt64() { return asInt64(0L); }

    /**
     * Return the value as a {@code float}.
     *
     * @param defaultValue if the type cannot convert
     * @return the converted value or {@code defaultValue}
     */
    public float asFloat(float defaultValue) {
        switch (type) {
            case BOOL:
            case INT64:
                return bits;
            case DOUBLE:
                return (float)doubleValue();
            default:
                return defaultValue;
        }
    }

    /**
     * Return the value as a {@code double}.
     *
     * @param defaultValue if the type cannot convert
     * @return the converted value or {@code defaultValue}
     */
    public double asDouble(double defaultValue) {
        switch (type) {
            case BOOL:
            case INT64:
                return bits;
            case DOUBLE:
                return doubleValue();
            default:
                return defaultValue;
        }
    }

    /**
     * Equivalent to {@code asDouble(0.0)}.
     *
     * @return the converted value or zero
     */
    public double asDouble() { return asDouble(0.0); }

    /**
     * Return the value as a {@code String}. Every type except
     * {@code NULL} (and a stale object reference) has a text form.
     *
     * @param defaultValue for {@code NULL} or a stale object
     * @return the converted value or {@code defaultValue}
     */
    public String asString(String defaultValue) {
        switch (type) {
            case NULL:
                return defaultValue;
            case STRING:
                return (String)ref;
            case OBJECT:
                return isStale() ? defaultValue : objectValue().toString();
            default:
                return toString();
        }
    }

    /**
     * Equivalent to {@code asString("")}.
     *
     * @return the converted value or an empty string
     */
    public String asString() { return asString(""); }

    /**
     * Return the object referenced, if this is an {@code OBJECT} and the
     * object is still alive.
     *
     * @param defaultValue otherwise
     * @return the object or {@code defaultValue}
     */
    public MetaObject asObject(MetaObject defaultValue) {
        if (type == Type.OBJECT) {
            ObjectData d = (ObjectData)ref;
            if (d.id.isValid()) { return d.object; }
        }
        return defaultValue;
    }

    /**
     * Equivalent to {@code asObject((MetaObject)null)}.
     *
     * @return the object or {@code null}
     */
    public MetaObject asObject() { return asObject((MetaObject)null); }

    /**
     * Return the object referenced, if this is an {@code OBJECT}, the
     * object is still alive, and it is an instance of the given class.
     *
     * @param <T> type required
     * @param klass of the object required
     * @return the object or {@code null}
     */
    public <T extends MetaObject> T asObject(Class<T> klass) {
        MetaObject o = asObject((MetaObject)null);
        return klass.isInstance(o) ? klass.cast(o) : null;
    }

    // Operators -----------------------------------------------------

    /**
     * Test whether an operator is defined for operands of the given
     * types. If this returns {@code false}, a call to
     * {@link #evaluate(Operator, Variant, Variant)} with operands of
     * these types would throw {@link UnsupportedOperatorError}.
     *
     * @param op operator
     * @param a type of the left operand
     * @param b type of the right operand
     * @return {@code true} iff the operation is supported
     */
    public static boolean canEvaluate(Operator op, Type a, Type b) {
        return Evaluators.canEvaluate(op, a, b);
    }

    /**
     * Apply an operator to two operands. The right operand of a unary
     * operator is ignored.
     *
     * @param op operator
     * @param a left operand
     * @param b right operand
     * @return result
     * @throws UnsupportedOperatorError if no implementation exists
     */
    public static Variant evaluate(Operator op, Variant a, Variant b)
            throws UnsupportedOperatorError {
        return Evaluators.evaluate(op, a, b);
    }

    /**
     * Apply an operator with this as the left operand.
     *
     * @param op operator
     * @param other right operand
     * @return result
     * @throws UnsupportedOperatorError if no implementation exists
     */
    public Variant evaluate(Operator op, Variant other)
            throws UnsupportedOperatorError {
        return Evaluators.evaluate(op, this, other);
    }

    /**
     * Apply a unary operator to this.
     *
     * @param op operator
     * @return result
     * @throws UnsupportedOperatorError if no implementation exists
     */
    public Variant evaluate(Operator op) throws UnsupportedOperatorError {
        return Evaluators.evaluate(op, this, NULL);
    }

    // Object --------------------------------------------------------

    /**
     * {@inheritDoc}
     * <p>
     * {@code Variant}s are equal when their types are equal and their
     * payloads are equal. Objects are equal only if they are the same
     * object with the same identity, and doubles compare as by
     * {@link Double#equals(Object)}.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (!(obj instanceof Variant)) { return false; }
        Variant o = (Variant)obj;
        if (o.type != type) { return false; }
        switch (type) {
            case NULL:
                return true;
            case STRING:
                return ref.equals(o.ref);
            case OBJECT:
                ObjectData d = (ObjectData)ref, od = (ObjectData)o.ref;
                return d.object == od.object && d.id.equals(od.id);
            case DOUBLE:
                return Double.doubleToLongBits(doubleValue()) == Double
                        .doubleToLongBits(o.doubleValue());
            default:
                return bits == o.bits;
        }
    }

    @Override
    public int hashCode() {
        int h = type.ordinal() * 31;
        switch (type) {
            case STRING:
                return h + ref.hashCode();
            case OBJECT:
                return h + ((ObjectData)ref).id.hashCode();
            case DOUBLE:
                return h + Double.hashCode(doubleValue());
            default:
                return h + Long.hashCode(bits);
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case NULL:
                return "null";
            case BOOL:
                return bits != 0L ? "true" : "false";
            case INT64:
                return Long.toString(bits);
            case DOUBLE:
                return Double.toString(doubleValue());
            case STRING:
                return (String)ref;
            default:
                ObjectData d = (ObjectData)ref;
                return d.id.isValid() ? d.object.toString()
                        : "<released object " + d.id + ">";
        }
    }
}
