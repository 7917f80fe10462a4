package com.cajunsystems.mirepoix.data;

/**
 * Error type of effects that cannot fail. No instance is ever created.
 */
public final class Nothing extends RuntimeException {
    private Nothing() {
        throw new AssertionError("Nothing has no instances");
    }
}
