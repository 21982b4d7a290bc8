// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.reflect;

/**
 * Thrown when a {@link PropertyBinding} is read without a getter,
 * written without a setter, or its accessor rejects the invocation.
 */
public class PropertyError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public PropertyError(String msg, Object... args) {
        super(String.format(msg, args));
    }
}
