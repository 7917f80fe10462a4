package com.cajunsystems.mirepoix;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

public interface Fiber<E extends Throwable, A> {
    UUID id();

    FiberState state();

    Optional<Exit<E, A>> poll();

    Exit<E, A> await() throws InterruptedException;

    Optional<Exit<E, A>> await(Duration timeout) throws InterruptedException;

    /**
     * Delivers an interruption signal. Returns immediately; the fiber reaches
     * {@link FiberState#INTERRUPTED} once the node it is running allows it.
     */
    void interrupt();

    boolean isInterruptRequested();
}
