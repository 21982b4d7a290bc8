// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
/**
 * The class registry and the bindings through which calling code finds
 * classes, invokes methods and accesses properties by name.
 * <p>
 * A Java class takes part by registering a
 * {@link uk.co.farowl.meta.reflect.ClassSpec} in its static
 * initialisation, producing its
 * {@link uk.co.farowl.meta.reflect.MetaClass}. The methods and
 * properties of the class are then available as
 * {@link uk.co.farowl.meta.reflect.MethodBinding}s and
 * {@link uk.co.farowl.meta.reflect.PropertyBinding}s that accept and
 * return {@link uk.co.farowl.meta.variant.Variant}s.
 */
package uk.co.farowl.meta.reflect;
