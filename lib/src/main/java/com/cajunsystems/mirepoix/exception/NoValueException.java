package com.cajunsystems.mirepoix.exception;

/**
 * Failure of an effect built from an empty {@link java.util.Optional}.
 * Carries no information, so a single stackless instance is shared.
 */
public final class NoValueException extends RuntimeException {
    public static final NoValueException INSTANCE = new NoValueException();

    private NoValueException() {
        super("No value present", null, false, false);
    }
}
