package com.cajunsystems.mirepoix.data;

import java.util.Objects;
import java.util.function.Function;

public sealed interface Try<A> {
    record Success<A>(A value) implements Try<A> {}

    record Failure<A>(Throwable cause) implements Try<A> {
        public Failure {
            Objects.requireNonNull(cause, "cause");
        }
    }

    static <A> Try<A> success(A value) {
        return new Success<>(value);
    }

    static <A> Try<A> failure(Throwable cause) {
        return new Failure<>(cause);
    }

    /**
     * Runs {@code computation} immediately and captures whatever it returns or raises.
     */
    static <A> Try<A> of(ThrowingSupplier<? extends A> computation) {
        try {
            return new Success<>(computation.get());
        } catch (Exception e) {
            return new Failure<>(e);
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default <T> T fold(Function<? super Throwable, ? extends T> onFailure, Function<? super A, ? extends T> onSuccess) {
        if (this instanceof Failure<A> failure) {
            return onFailure.apply(failure.cause());
        }
        return onSuccess.apply(((Success<A>) this).value());
    }
}
