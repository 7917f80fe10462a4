package com.cajunsystems.mirepoix;

import com.cajunsystems.mirepoix.exception.CancelledException;
import com.cajunsystems.mirepoix.exception.DefectException;

import java.util.Objects;
import java.util.UUID;

/**
 * The outcome of one run of an effect. Typed failures and defects are kept apart.
 */
public sealed interface Exit<E extends Throwable, A> {
    record Success<E extends Throwable, A>(A value) implements Exit<E, A> {}
    record Failure<E extends Throwable, A>(E error) implements Exit<E, A> {}
    record Die<E extends Throwable, A>(DefectException defect) implements Exit<E, A> {}
    record Interrupted<E extends Throwable, A>(UUID fiberId) implements Exit<E, A> {}

    static <E extends Throwable, A> Exit<E, A> succeed(A value) {
        return new Success<>(value);
    }

    static <E extends Throwable, A> Exit<E, A> fail(E error) {
        Objects.requireNonNull(error, "error");
        return new Failure<>(error);
    }

    static <E extends Throwable, A> Exit<E, A> die(ConstructionSite site, Throwable cause) {
        return new Die<>(new DefectException(site, cause));
    }

    static <E extends Throwable, A> Exit<E, A> interrupted(UUID fiberId) {
        return new Interrupted<>(fiberId);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isInterrupted() {
        return this instanceof Interrupted;
    }

    /**
     * Returns the value, or throws the typed error, the defect, or a {@link CancelledException}.
     */
    default A getOrThrow() throws E {
        if (this instanceof Success<E, A> success) {
            return success.value();
        }
        if (this instanceof Failure<E, A> failure) {
            throw failure.error();
        }
        if (this instanceof Die<E, A> die) {
            throw die.defect();
        }
        throw new CancelledException(((Interrupted<E, A>) this).fiberId());
    }
}
