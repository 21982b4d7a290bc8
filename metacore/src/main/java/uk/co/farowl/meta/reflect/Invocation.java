// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.reflect;

import uk.co.farowl.meta.variant.Variant;

/**
 * The result of invoking a {@link MethodBinding}: a status and, if the
 * status is {@link InvokeStatus#OK}, the value returned.
 */
public final class Invocation {

    private final InvokeStatus status;
    private final Variant value;
    private final String message;

    private Invocation(InvokeStatus status, Variant value, String message) {
        this.status = status;
        this.value = value;
        this.message = message;
    }

    /**
     * A successful invocation.
     *
     * @param value returned by the method ({@link Variant#NULL} if
     *     {@code void})
     * @return the result
     */
    static Invocation ok(Variant value) {
        return new Invocation(InvokeStatus.OK, value, null);
    }

    /**
     * An invocation rejected before the method was called.
     *
     * @param status the reason (not {@code OK})
     * @param message explaining the rejection
     * @return the result
     */
    static Invocation rejected(InvokeStatus status, String message) {
        assert status != InvokeStatus.OK;
        return new Invocation(status, Variant.NULL, message);
    }

    /** @return the status of the invocation */
    public InvokeStatus getStatus() { return status; }

    /** @return whether the status is {@code OK} */
    public boolean isOK() { return status == InvokeStatus.OK; }

    /**
     * The value the method returned. This is {@link Variant#NULL} if
     * the method is {@code void} or was not called.
     *
     * @return the value returned
     */
    public Variant getValue() { return value; }

    /**
     * The reason the invocation was rejected, or {@code null} if it was
     * not.
     *
     * @return explanation or {@code null}
     */
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return isOK() ? "OK: " + value : status + ": " + message;
    }
}
