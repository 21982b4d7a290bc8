// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.reflect;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

/**
 * Annotations that may be placed on elements of a Java class that
 * registers itself with the {@link Reflection} registry, and that the
 * class exposer will look for when the {@link MetaClass} is created from
 * a {@link ClassSpec}.
 */
public interface Exposed {

    /**
     * Identify a method (static or instance) as one to be exposed by
     * name in the {@link MetaClass}. The signature must use only types
     * for which conversions from and to {@code Variant} exist.
     * <p>
     * Annotations may appear on the parameters of a method annotated
     * with {@code JavaMethod}, naming them or providing default values.
     */
    @Documented
    @Retention(RUNTIME)
    @Target(METHOD)
    @interface JavaMethod {

        /**
         * Exposed name of the method if different from the declaration.
         *
         * @return name of the method
         */
        String value() default "";
    }

    /**
     * Declare that an instance method does not change the state of its
     * receiver. A {@code Const} method may not be used as the setter of
     * a property.
     */
    @Documented
    @Retention(RUNTIME)
    @Target(METHOD)
    @interface Const {}

    /**
     * Override the name of a parameter to a method defined in Java, as
     * it will appear in the binding. Without this annotation, the name
     * compiled into the class is used, which is only meaningful if the
     * class was compiled with {@code -parameters}.
     */
    @Documented
    @Retention(RUNTIME)
    @Target(PARAMETER)
    @interface Name { String value(); }

    /**
     * Provide a default value for a parameter, as text to be parsed
     * according to the type of the parameter. Only a trailing sequence
     * of parameters may have defaults.
     */
    @Documented
    @Retention(RUNTIME)
    @Target(PARAMETER)
    @interface Default { String value(); }

    /**
     * Identify a method as the getter of a property. The method must
     * accept no arguments.
     */
    @Documented
    @Retention(RUNTIME)
    @Target(METHOD)
    @interface Getter {

        /**
         * Exposed name of the property, if different from the Java
         * method name. This name will relate the {@link Getter} and
         * {@link Setter} in a single property.
         *
         * @return name of the property
         */
        String value() default "";
    }

    /**
     * Identify a method as the setter of a property. The method must be
     * a non-{@link Const} instance method accepting one argument.
     */
    @Documented
    @Retention(RUNTIME)
    @Target(METHOD)
    @interface Setter {

        /**
         * Exposed name of the property, if different from the Java
         * method name. This name will relate the {@link Getter} and
         * {@link Setter} in a single property.
         *
         * @return name of the property
         */
        String value() default "";
    }
}
