// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
/**
 * The dynamically-typed value {@link uk.co.farowl.meta.variant.Variant}
 * with which arguments and return values cross the reflection boundary,
 * and the operator dispatch table that lets calling code combine values
 * without knowing their types.
 */
package uk.co.farowl.meta.variant;
