package com.cajunsystems.mirepoix.runtime;

import com.cajunsystems.mirepoix.Exit;
import com.cajunsystems.mirepoix.Fiber;
import com.cajunsystems.mirepoix.FiberState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

class FiberRuntime<E extends Throwable, A> implements Fiber<E, A> {
    private static final Logger log = LoggerFactory.getLogger(FiberRuntime.class);

    private final UUID id;
    private final AtomicReference<FiberState> state = new AtomicReference<>(FiberState.PENDING);
    private final CompletableFuture<Exit<E, A>> resultFuture = new CompletableFuture<>();
    private final ExecutionContext context;

    @SuppressWarnings("unchecked")
    FiberRuntime(UUID id, Object environment, RuntimePools pools) {
        this.id = id;
        this.context = new ExecutionContext(id, environment, pools, exit -> complete((Exit<E, A>) (Exit<?, ?>) exit));
    }

    ExecutionContext context() {
        return context;
    }

    boolean start() {
        if (state.compareAndSet(FiberState.PENDING, FiberState.RUNNING)) {
            log.debug("Fiber {} started", id);
            return true;
        }
        return false;
    }

    // A pending interrupt replaces a success or typed failure; defects are kept
    void complete(Exit<E, A> exit) {
        Exit<E, A> outcome = exit;
        if (context.isInterruptRequested() && (exit instanceof Exit.Success || exit instanceof Exit.Failure)) {
            outcome = Exit.interrupted(id);
        }
        FiberState terminal = terminalState(outcome);
        if (!state.compareAndSet(FiberState.RUNNING, terminal)) {
            log.debug("Fiber {} already in state {}, dropping outcome {}", id, state.get(), outcome);
            return;
        }
        if (outcome instanceof Exit.Die<E, A> die) {
            log.warn("Fiber {} died", id, die.defect());
        } else {
            log.debug("Fiber {} finished in state {}", id, terminal);
        }
        resultFuture.complete(outcome);
    }

    @Override
    public UUID id() {
        return id;
    }

    @Override
    public FiberState state() {
        return state.get();
    }

    @Override
    public Optional<Exit<E, A>> poll() {
        return Optional.ofNullable(resultFuture.getNow(null));
    }

    @Override
    public Exit<E, A> await() throws InterruptedException {
        try {
            return resultFuture.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Fiber result future completed exceptionally", e.getCause());
        }
    }

    @Override
    public Optional<Exit<E, A>> await(Duration timeout) throws InterruptedException {
        try {
            return Optional.of(resultFuture.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Fiber result future completed exceptionally", e.getCause());
        }
    }

    @Override
    public void interrupt() {
        if (state.compareAndSet(FiberState.PENDING, FiberState.INTERRUPTED)) {
            context.interrupt();
            log.debug("Fiber {} interrupted before it started", id);
            resultFuture.complete(Exit.interrupted(id));
            return;
        }
        if (!state.get().isTerminal()) {
            context.interrupt();
        }
    }

    @Override
    public boolean isInterruptRequested() {
        return context.isInterruptRequested();
    }

    private static FiberState terminalState(Exit<?, ?> exit) {
        if (exit instanceof Exit.Success) {
            return FiberState.COMPLETED;
        }
        if (exit instanceof Exit.Interrupted) {
            return FiberState.INTERRUPTED;
        }
        return FiberState.FAILED;
    }
}
