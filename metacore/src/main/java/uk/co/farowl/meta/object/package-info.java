// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
/**
 * The root classes of registered objects and the identity by which the
 * reflection layer tells whether an object is still alive.
 */
package uk.co.farowl.meta.object;
