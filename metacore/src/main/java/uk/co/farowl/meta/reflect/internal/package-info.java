// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
/**
 * Adaptation of Java method handles to the {@code Variant} calling
 * convention of method bindings.
 */
package uk.co.farowl.meta.reflect.internal;
