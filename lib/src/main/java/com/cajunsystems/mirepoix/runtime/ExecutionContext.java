package com.cajunsystems.mirepoix.runtime;

import com.cajunsystems.mirepoix.ConstructionSite;
import com.cajunsystems.mirepoix.Exit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

class ExecutionContext {
    private static final Logger log = LoggerFactory.getLogger(ExecutionContext.class);
    private static final ConstructionSite RESUME_SITE = ConstructionSite.internal("resume");
    private static final ConstructionSite BLOCKING_SITE = ConstructionSite.internal("runOnBlocking");

    private final UUID fiberId;
    private final Object environment;
    private final RuntimePools pools;
    private final Consumer<Exit<Throwable, Object>> onLostResumption;
    private final AtomicBoolean interruptRequested = new AtomicBoolean(false);
    private final AtomicReference<Runnable> interruptHandler = new AtomicReference<>();

    ExecutionContext(
            UUID fiberId,
            Object environment,
            RuntimePools pools,
            Consumer<Exit<Throwable, Object>> onLostResumption
    ) {
        this.fiberId = fiberId;
        this.environment = environment;
        this.pools = pools;
        this.onLostResumption = onLostResumption;
    }

    UUID fiberId() {
        return fiberId;
    }

    Object environment() {
        return environment;
    }

    RuntimePools pools() {
        return pools;
    }

    boolean onBlockingThread() {
        return pools.isBlockingThread(Thread.currentThread());
    }

    void runOnComputation(Runnable task) {
        pools.executeComputation(task);
    }

    <T> void runOnBlocking(Supplier<? extends T> work, Consumer<? super T> then) {
        try {
            pools.executeBlocking(work, then);
        } catch (RejectedExecutionException e) {
            lose("blocking", BLOCKING_SITE, e);
        }
    }

    void runOnBlocking(Runnable task) {
        try {
            pools.executeBlocking(task);
        } catch (RejectedExecutionException e) {
            lose("blocking", BLOCKING_SITE, e);
        }
    }

    // onInterrupt runs at most once: now if an interrupt is already pending, else when one arrives
    void suspend(Runnable onInterrupt) {
        interruptHandler.set(onInterrupt);
        if (interruptRequested.get() && interruptHandler.compareAndSet(onInterrupt, null)) {
            onInterrupt.run();
        }
    }

    void leave(Runnable onInterrupt) {
        interruptHandler.compareAndSet(onInterrupt, null);
    }

    void resume(Runnable continuation) {
        try {
            runOnComputation(continuation);
        } catch (RejectedExecutionException e) {
            lose("computation", RESUME_SITE, e);
        }
    }

    void interrupt() {
        interruptRequested.set(true);
        Runnable handler = interruptHandler.getAndSet(null);
        if (handler != null) {
            handler.run();
        }
    }

    boolean isInterruptRequested() {
        return interruptRequested.get();
    }

    private void lose(String pool, ConstructionSite site, RejectedExecutionException e) {
        log.warn("Fiber {} could not continue, {} pool rejected the task", fiberId, pool);
        onLostResumption.accept(Exit.die(site, e));
    }
}
