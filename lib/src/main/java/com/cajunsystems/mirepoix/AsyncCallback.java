package com.cajunsystems.mirepoix;

@FunctionalInterface
public interface AsyncCallback<E extends Throwable, A> {

    /**
     * @return {@code true} if this call resolved the effect, {@code false} if it was already
     *         resolved or interrupted
     */
    boolean resume(Exit<E, A> outcome);

    default boolean succeed(A value) {
        return resume(Exit.succeed(value));
    }

    default boolean fail(E error) {
        return resume(Exit.fail(error));
    }
}
