// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.reflect;

/** Outcome of an attempt to invoke a {@link MethodBinding}. */
public enum InvokeStatus {
    /** The method was called and returned normally. */
    OK,
    /**
     * The number of arguments was outside the range the binding
     * accepts. The method was not called.
     */
    ARGUMENT_COUNT_MISMATCH,
    /**
     * The receiver was missing, not an instance of the declaring class,
     * or no longer alive. The method was not called.
     */
    INVALID_RECEIVER;
}
