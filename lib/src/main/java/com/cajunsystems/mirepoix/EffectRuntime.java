package com.cajunsystems.mirepoix;

import com.cajunsystems.mirepoix.data.Unit;
import com.cajunsystems.mirepoix.runtime.RuntimePools;

public interface EffectRuntime extends AutoCloseable {

    /**
     * Runs an effect that needs no environment and blocks for its outcome.
     *
     * @throws E the typed failure
     * @throws com.cajunsystems.mirepoix.exception.DefectException if the run died
     * @throws com.cajunsystems.mirepoix.exception.CancelledException if the run was interrupted
     */
    <E extends Throwable, A> A unsafeRun(Effect<? super Unit, E, A> effect) throws E;

    <R, E extends Throwable, A> A unsafeRun(Effect<R, E, A> effect, R environment) throws E;

    <R, E extends Throwable, A> Exit<E, A> unsafeRunExit(Effect<R, E, A> effect, R environment);

    <R, E extends Throwable, A> Fiber<E, A> fork(Effect<R, E, A> effect, R environment);

    @SuppressWarnings("unchecked")
    default <E extends Throwable, A> Fiber<E, A> fork(Effect<? super Unit, E, A> effect) {
        return fork((Effect<Unit, E, A>) effect, Unit.unit());
    }

    RuntimePools pools();

    @Override
    void close();
}
