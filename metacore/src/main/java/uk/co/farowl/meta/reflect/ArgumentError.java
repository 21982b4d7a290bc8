// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.reflect;

/**
 * The exception thrown internally when a method binding is invoked
 * with a number of arguments it does not accept. An
 * {@code ArgumentError} encapsulates how many arguments the binding
 * expected. It does not name the method, since that context may not be
 * in scope at discovery. It should be caught as soon as the context is
 * available and turned into an {@link Invocation} with status
 * {@link InvokeStatus#ARGUMENT_COUNT_MISMATCH}.
 */
public class ArgumentError extends Exception {
    private static final long serialVersionUID = 1L;

    /**
     * The types of problem {@code ArgumentError} can express in an
     * error message. These will emerge in {@link #toString()}.
     */
    public enum Mode {
        /** Method takes no arguments */
        NOARGS,
        /** Method takes [numArgs] arguments */
        NUMARGS,
        /** Method takes from [minArgs] to [maxArgs] arguments */
        MINMAXARGS;

        /**
         * Choose a mode based on the min and max argument numbers
         *
         * @param minArgs minimum expected number of arguments
         * @param maxArgs maximum expected number of arguments
         * @return a mode
         */
        static Mode choose(int minArgs, int maxArgs) {
            if (minArgs != maxArgs)
                return MINMAXARGS;
            else if (minArgs != 0)
                return NUMARGS;
            else
                return NOARGS;
        }
    }

    final Mode mode;
    final int minArgs, maxArgs, given;

    /**
     * Create an {@code ArgumentError} with mode
     * {@link Mode#MINMAXARGS}, {@link Mode#NUMARGS} or
     * {@link Mode#NOARGS} according to the arguments.
     *
     * @param minArgs minimum expected number of arguments
     * @param maxArgs maximum expected number of arguments
     * @param given number of arguments actually supplied
     */
    public ArgumentError(int minArgs, int maxArgs, int given) {
        this.mode = Mode.choose(minArgs, maxArgs);
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.given = given;
    }

    /** @return the mode of this error */
    public Mode getMode() { return mode; }

    @Override
    public String getMessage() { return toString(); }

    @Override
    public String toString() {
        switch (mode) {
            case NOARGS:
                return String.format("takes no arguments (%d given)",
                        given);
            case NUMARGS:
                return String.format("takes %d arguments (%d given)",
                        minArgs, given);
            default:
                return String.format(
                        "takes from %d to %d arguments (%d given)",
                        minArgs, maxArgs, given);
        }
    }
}
