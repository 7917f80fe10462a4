package com.cajunsystems.mirepoix.data;

import java.util.function.Function;

public sealed interface Either<L, R> {
    record Left<L, R>(L value) implements Either<L, R> {}
    record Right<L, R>(R value) implements Either<L, R> {}

    static <L, R> Either<L, R> left(L value) {
        return new Left<>(value);
    }

    static <L, R> Either<L, R> right(R value) {
        return new Right<>(value);
    }

    default boolean isRight() {
        return this instanceof Right;
    }

    default <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight) {
        if (this instanceof Left<L, R> left) {
            return onLeft.apply(left.value());
        }
        return onRight.apply(((Right<L, R>) this).value());
    }
}
