// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
/**
 * Classes supporting the meta-object system that are needed in more
 * than one of its packages.
 */
package uk.co.farowl.meta.support;
