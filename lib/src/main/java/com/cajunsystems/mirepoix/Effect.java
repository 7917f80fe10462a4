package com.cajunsystems.mirepoix;

import com.cajunsystems.mirepoix.data.Either;
import com.cajunsystems.mirepoix.data.Nothing;
import com.cajunsystems.mirepoix.data.ThrowingSupplier;
import com.cajunsystems.mirepoix.data.Try;
import com.cajunsystems.mirepoix.exception.NoValueException;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * An immutable description of a computation that has not run yet.
 *
 * @param <R> environment the effect needs to run
 * @param <E> typed error channel
 * @param <A> success value
 */
public sealed interface Effect<R, E extends Throwable, A> {

    // Eager
    record Pure<R, E extends Throwable, A>(A value) implements Effect<R, E, A> {}
    record Fail<R, E extends Throwable, A>(E error) implements Effect<R, E, A> {}

    // Deferred
    record Total<R, E extends Throwable, A>(
            Supplier<? extends A> thunk,
            ConstructionSite site
    ) implements Effect<R, E, A> {}
    record Attempt<R, A>(
            ThrowingSupplier<? extends A> thunk,
            ConstructionSite site
    ) implements Effect<R, Throwable, A> {}
    record FunctionOf<R, A>(
            Function<? super R, ? extends A> f,
            ConstructionSite site
    ) implements Effect<R, Nothing, A> {}

    // Suspending
    record Async<R, E extends Throwable, A>(
            AsyncRegister<E, A> register,
            Runnable cancelHook,
            ConstructionSite site
    ) implements Effect<R, E, A> {}
    record FromFuture<R, A>(
            Function<? super Executor, ? extends CompletionStage<A>> provider,
            ConstructionSite site
    ) implements Effect<R, Throwable, A> {}

    // Blocking pool
    record Blocking<R, A>(
            ThrowingSupplier<? extends A> thunk,
            Runnable cancelThunk,
            ConstructionSite site
    ) implements Effect<R, Throwable, A> {}
    record OnBlocking<R, E extends Throwable, A>(
            Effect<R, E, A> source
    ) implements Effect<R, E, A> {}

    record RefineOrDie<R, E extends Throwable, E2 extends Throwable, A>(
            Effect<R, E, A> source,
            Function<? super E, ? extends Optional<? extends E2>> classifier,
            ConstructionSite site
    ) implements Effect<R, E2, A> {}

    // Values and conversions

    static <R, E extends Throwable, A> Effect<R, E, A> succeed(A value) {
        return new Pure<>(value);
    }

    static <R, E extends Throwable, A> Effect<R, E, A> succeedLazy(Supplier<? extends A> thunk) {
        Objects.requireNonNull(thunk, "thunk");
        return new Total<>(thunk, ConstructionSite.capture("succeedLazy"));
    }

    static <R, E extends Throwable, A> Effect<R, E, A> fail(E error) {
        Objects.requireNonNull(error, "error");
        return new Fail<>(error);
    }

    static <R, A> Effect<R, NoValueException, A> fromOption(Optional<? extends A> option) {
        if (option.isPresent()) {
            return new Pure<>(option.get());
        }
        return new Fail<>(NoValueException.INSTANCE);
    }

    static <R, E extends Throwable, A> Effect<R, E, A> fromEither(Either<? extends E, ? extends A> either) {
        return either.fold(
                error -> Effect.<R, E, A>fail(error),
                value -> new Pure<R, E, A>(value)
        );
    }

    static <R, A> Effect<R, Throwable, A> fromTry(Try<? extends A> attempt) {
        return attempt.fold(
                cause -> new Fail<R, Throwable, A>(cause),
                value -> new Pure<R, Throwable, A>(value)
        );
    }

    static <R, A> Effect<R, Nothing, A> fromFunction(Function<? super R, ? extends A> f) {
        Objects.requireNonNull(f, "f");
        return new FunctionOf<>(f, ConstructionSite.capture("fromFunction"));
    }

    /**
     * Bridges an eventual value. The provider receives the executor continuation work
     * should run on and is called once per run.
     */
    static <R, A> Effect<R, Throwable, A> fromFuture(
            Function<? super Executor, ? extends CompletionStage<A>> provider
    ) {
        Objects.requireNonNull(provider, "provider");
        return new FromFuture<>(provider, ConstructionSite.capture("fromFuture"));
    }

    // Side effects

    static <R, A> Effect<R, Throwable, A> effect(ThrowingSupplier<? extends A> thunk) {
        Objects.requireNonNull(thunk, "thunk");
        return new Attempt<>(thunk, ConstructionSite.capture("effect"));
    }

    /**
     * Runs a thunk the caller asserts cannot raise. If it raises anyway the run dies
     * with a {@link com.cajunsystems.mirepoix.exception.DefectException}.
     */
    static <R, E extends Throwable, A> Effect<R, E, A> effectTotal(Supplier<? extends A> thunk) {
        Objects.requireNonNull(thunk, "thunk");
        return new Total<>(thunk, ConstructionSite.capture("effectTotal"));
    }

    /**
     * Suspends until {@code register} calls back. Without a cancel hook the effect cannot
     * be interrupted while it waits; interruption takes effect once it resolves.
     */
    static <R, E extends Throwable, A> Effect<R, E, A> effectAsync(AsyncRegister<E, A> register) {
        Objects.requireNonNull(register, "register");
        return new Async<>(register, null, ConstructionSite.capture("effectAsync"));
    }

    /**
     * Suspends until {@code register} calls back. On interruption while pending, later
     * callbacks are ignored and {@code cancelHook} runs exactly once.
     */
    static <R, E extends Throwable, A> Effect<R, E, A> effectAsync(
            AsyncRegister<E, A> register,
            Runnable cancelHook
    ) {
        Objects.requireNonNull(register, "register");
        Objects.requireNonNull(cancelHook, "cancelHook");
        return new Async<>(register, cancelHook, ConstructionSite.capture("effectAsync"));
    }

    // Blocking

    static <R, A> Effect<R, Throwable, A> effectBlocking(ThrowingSupplier<? extends A> thunk) {
        Objects.requireNonNull(thunk, "thunk");
        return new Blocking<>(thunk, null, ConstructionSite.capture("effectBlocking"));
    }

    /**
     * Runs the thunk on the blocking pool. On interruption {@code cancelThunk} runs once and
     * must make the thunk return.
     */
    static <R, A> Effect<R, Throwable, A> effectBlockingCancelable(
            ThrowingSupplier<? extends A> thunk,
            Runnable cancelThunk
    ) {
        Objects.requireNonNull(thunk, "thunk");
        Objects.requireNonNull(cancelThunk, "cancelThunk");
        return new Blocking<>(thunk, cancelThunk, ConstructionSite.capture("effectBlockingCancelable"));
    }

    static <R, E extends Throwable, A> Effect<R, E, A> blocking(Effect<R, E, A> effect) {
        Objects.requireNonNull(effect, "effect");
        if (effect instanceof OnBlocking || effect instanceof Blocking) {
            return effect;
        }
        return new OnBlocking<>(effect);
    }

    // Error refinement

    /**
     * Keeps the errors {@code classify} recognizes as typed failures and turns every other
     * error into a defect.
     */
    default <E2 extends Throwable> Effect<R, E2, A> refineToOrDie(
            Function<? super E, ? extends Optional<? extends E2>> classify
    ) {
        Objects.requireNonNull(classify, "classify");
        return new RefineOrDie<>(this, classify, ConstructionSite.capture("refineToOrDie"));
    }

    default <E2 extends Throwable> Effect<R, E2, A> refineToOrDie(Class<E2> type) {
        Objects.requireNonNull(type, "type");
        return new RefineOrDie<R, E, E2, A>(
                this,
                error -> type.isInstance(error) ? Optional.of(type.cast(error)) : Optional.empty(),
                ConstructionSite.capture("refineToOrDie")
        );
    }
}
