package com.cajunsystems.mirepoix.runtime;

import com.cajunsystems.mirepoix.Exit;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

// First offer or close wins
final class OneShot<E extends Throwable, A> {
    private final AtomicBoolean resolved = new AtomicBoolean(false);
    private final Consumer<Exit<E, A>> receiver;

    OneShot(Consumer<Exit<E, A>> receiver) {
        this.receiver = receiver;
    }

    boolean offer(Exit<E, A> outcome) {
        if (!resolved.compareAndSet(false, true)) {
            return false;
        }
        receiver.accept(outcome);
        return true;
    }

    boolean close() {
        return resolved.compareAndSet(false, true);
    }

    boolean isResolved() {
        return resolved.get();
    }
}
