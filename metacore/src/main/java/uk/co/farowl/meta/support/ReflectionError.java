// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Error thrown when a class cannot be registered or bound, or when the
 * meta-object system finds itself in a state it cannot recover from.
 * Application code is not expected to catch it.
 * <p>
 * Most are raised while a Java class registers itself in its static
 * initialiser. The JVM reports those as an
 * {@code ExceptionInInitializerError} on first use of the class, often
 * far from the cause, so every {@code ReflectionError} is logged at
 * WARN as it is created. Where the error concerns a particular
 * registered class, {@link #inClass(String, String, Object...)} records
 * its name, which then leads the message and is available from
 * {@link #getClassName()}.
 */
public class ReflectionError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /** Logger for errors as they are raised. */
    static final Logger logger =
            LoggerFactory.getLogger(ReflectionError.class);

    /** Qualified name of the class concerned or {@code null}. */
    private final String className;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public ReflectionError(String msg, Object... args) {
        this(String.format(msg, args), null, null);
    }

    /**
     * Constructor specifying a cause and a message.
     *
     * @param cause a Java exception behind the error
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public ReflectionError(Throwable cause, String msg, Object... args) {
        this(String.format(msg, args), cause, null);
    }

    /**
     * Constructor specifying only a cause. The message is the text of
     * the cause, including its type.
     *
     * @param cause a Java exception behind the error
     */
    public ReflectionError(Throwable cause) {
        this(cause.toString(), cause, null);
    }

    private ReflectionError(String message, Throwable cause,
            String className) {
        super(className == null ? message
                : String.format("class '%s': %s", className, message),
                cause);
        this.className = className;
        logger.atWarn().setCause(cause).log(getMessage());
    }

    /**
     * Create an error concerning the definition or registration of a
     * named class.
     *
     * @param className qualified name of the class concerned
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     * @return the error (to throw)
     */
    public static ReflectionError inClass(String className, String msg,
            Object... args) {
        return new ReflectionError(String.format(msg, args), null,
                className);
    }

    /**
     * The qualified name of the class that was being defined or
     * registered when the error arose, if known.
     *
     * @return name of the class or {@code null}
     */
    public String getClassName() { return className; }
}
