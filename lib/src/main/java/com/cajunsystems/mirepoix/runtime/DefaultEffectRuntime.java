package com.cajunsystems.mirepoix.runtime;

import com.cajunsystems.mirepoix.AsyncCallback;
import com.cajunsystems.mirepoix.AsyncRegister;
import com.cajunsystems.mirepoix.ConstructionSite;
import com.cajunsystems.mirepoix.Effect;
import com.cajunsystems.mirepoix.EffectRuntime;
import com.cajunsystems.mirepoix.Exit;
import com.cajunsystems.mirepoix.Fiber;
import com.cajunsystems.mirepoix.data.Unit;
import com.cajunsystems.mirepoix.exception.CancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Interprets {@link Effect} nodes on a pair of {@link RuntimePools}. Each node variant has
 * exactly one case in {@link #evaluate}; outcomes are passed on as {@link Exit} values.
 */
public class DefaultEffectRuntime implements EffectRuntime {
    private static final Logger log = LoggerFactory.getLogger(DefaultEffectRuntime.class);

    private final RuntimePools pools;
    private final boolean ownsPools;

    public DefaultEffectRuntime(RuntimePools pools, boolean ownsPools) {
        this.pools = Objects.requireNonNull(pools, "pools");
        this.ownsPools = ownsPools;
    }

    public static DefaultEffectRuntime create() {
        return create(RuntimeConfig.fromSystemProperties());
    }

    public static DefaultEffectRuntime create(RuntimeConfig config) {
        return new DefaultEffectRuntime(RuntimePools.create(config), true);
    }

    /**
     * A runtime on the process-wide pools. Closing it leaves the pools running.
     */
    public static DefaultEffectRuntime shared() {
        return new DefaultEffectRuntime(RuntimePools.shared(), false);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <E extends Throwable, A> A unsafeRun(Effect<? super Unit, E, A> effect) throws E {
        return unsafeRun((Effect<Unit, E, A>) effect, Unit.unit());
    }

    @Override
    public <R, E extends Throwable, A> A unsafeRun(Effect<R, E, A> effect, R environment) throws E {
        return unsafeRunExit(effect, environment).getOrThrow();
    }

    @Override
    public <R, E extends Throwable, A> Exit<E, A> unsafeRunExit(Effect<R, E, A> effect, R environment) {
        Fiber<E, A> fiber = fork(effect, environment);
        try {
            return fiber.await();
        } catch (InterruptedException e) {
            fiber.interrupt();
            Thread.currentThread().interrupt();
            throw new CancelledException(e);
        }
    }

    @Override
    public <R, E extends Throwable, A> Fiber<E, A> fork(Effect<R, E, A> effect, R environment) {
        Objects.requireNonNull(effect, "effect");
        if (pools.isClosed()) {
            throw new IllegalStateException("Runtime pools are closed");
        }
        FiberRuntime<E, A> fiber = new FiberRuntime<>(UUID.randomUUID(), environment, pools);
        log.debug("Forking fiber {} for {}", fiber.id(), effect.getClass().getSimpleName());
        pools.executeComputation(() -> {
            if (fiber.start()) {
                evaluate(effect, fiber.context(), fiber::complete);
            }
        });
        return fiber;
    }

    @Override
    public RuntimePools pools() {
        return pools;
    }

    @Override
    public void close() {
        if (ownsPools) {
            pools.close();
        }
    }

    @SuppressWarnings("unchecked")
    private <E extends Throwable, A> void evaluate(
            Effect<?, E, A> effect,
            ExecutionContext ctx,
            Consumer<Exit<E, A>> k
    ) {
        // Checkpoint at boundary
        if (ctx.isInterruptRequested()) {
            k.accept(Exit.interrupted(ctx.fiberId()));
            return;
        }

        if (effect instanceof Effect.Pure<?, ?, ?> pure) {
            k.accept(Exit.succeed((A) pure.value()));
        } else if (effect instanceof Effect.Fail<?, ?, ?> fail) {
            k.accept(Exit.fail((E) fail.error()));
        } else if (effect instanceof Effect.Total<?, ?, ?> total) {
            k.accept(runTotal(total));
        } else if (effect instanceof Effect.Attempt<?, ?> attempt) {
            k.accept(runAttempt(attempt));
        } else if (effect instanceof Effect.FunctionOf<?, ?> functionOf) {
            k.accept(runFunction(functionOf, ctx));
        } else if (effect instanceof Effect.Async<?, ?, ?> async) {
            evaluateAsync(async, ctx, k);
        } else if (effect instanceof Effect.FromFuture<?, ?> fromFuture) {
            evaluateFuture(fromFuture, ctx, k);
        } else if (effect instanceof Effect.Blocking<?, ?> blocking) {
            evaluateBlocking(blocking, ctx, k);
        } else if (effect instanceof Effect.OnBlocking<?, ?, ?> onBlocking) {
            evaluateOnBlocking((Effect<?, E, A>) onBlocking.source(), ctx, k);
        } else if (effect instanceof Effect.RefineOrDie<?, ?, ?, ?> refine) {
            evaluateRefine(refine, ctx, k);
        } else {
            throw new IllegalStateException("Unknown effect variant: " + effect.getClass().getName());
        }
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable, A> Exit<E, A> runTotal(Effect.Total<?, ?, ?> total) {
        try {
            return Exit.succeed((A) total.thunk().get());
        } catch (Throwable t) {
            return Exit.die(total.site(), t);
        }
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable, A> Exit<E, A> runAttempt(Effect.Attempt<?, ?> attempt) {
        try {
            return Exit.succeed((A) attempt.thunk().get());
        } catch (Throwable t) {
            return failOrDie(attempt.site(), t);
        }
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable, A> Exit<E, A> runFunction(
            Effect.FunctionOf<?, ?> functionOf,
            ExecutionContext ctx
    ) {
        Function<Object, ?> f = (Function<Object, ?>) (Function<?, ?>) functionOf.f();
        try {
            return Exit.succeed((A) f.apply(ctx.environment()));
        } catch (Throwable t) {
            return Exit.die(functionOf.site(), t);
        }
    }

    @SuppressWarnings("unchecked")
    private <E extends Throwable, A> void evaluateAsync(
            Effect.Async<?, ?, ?> async,
            ExecutionContext ctx,
            Consumer<Exit<E, A>> k
    ) {
        AsyncRegister<E, A> register = (AsyncRegister<E, A>) async.register();
        Runnable cancelHook = async.cancelHook();

        // One channel per run, never shared between runs of the same node
        OneShot<E, A> channel = new OneShot<>(outcome -> ctx.resume(() -> k.accept(outcome)));
        Runnable onInterrupt = cancelHook == null ? null : () -> {
            if (channel.close()) {
                log.debug("Fiber {} interrupted while suspended in {}", ctx.fiberId(), async.site());
                runHook(cancelHook, async.site(), ctx.fiberId());
                ctx.resume(() -> k.accept(Exit.interrupted(ctx.fiberId())));
            }
        };
        AsyncCallback<E, A> callback = outcome -> {
            Objects.requireNonNull(outcome, "outcome");
            boolean resolved = channel.offer(outcome);
            if (resolved && onInterrupt != null) {
                ctx.leave(onInterrupt);
            }
            return resolved;
        };

        if (onInterrupt != null) {
            ctx.suspend(onInterrupt);
            if (channel.isResolved()) {
                return;
            }
        }
        try {
            register.register(callback);
        } catch (Throwable t) {
            // Only checked exceptions are known to be E; anything unchecked is a defect
            Exit<E, A> fault = t instanceof RuntimeException || t instanceof Error
                    ? Exit.die(async.site(), t)
                    : Exit.fail((E) t);
            if (!callback.resume(fault)) {
                log.debug("Registration in {} raised after resolving", async.site(), t);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private <E extends Throwable, A> void evaluateFuture(
            Effect.FromFuture<?, ?> fromFuture,
            ExecutionContext ctx,
            Consumer<Exit<E, A>> k
    ) {
        CompletionStage<A> stage;
        try {
            stage = (CompletionStage<A>) fromFuture.provider().apply(ctx.pools().computation());
            Objects.requireNonNull(stage, "provider returned null");
        } catch (Throwable t) {
            k.accept(failOrDie(fromFuture.site(), t));
            return;
        }

        OneShot<E, A> channel = new OneShot<>(outcome -> ctx.resume(() -> k.accept(outcome)));
        Runnable onInterrupt = () -> {
            if (channel.close()) {
                if (stage instanceof Future<?> future) {
                    future.cancel(true);
                }
                ctx.resume(() -> k.accept(Exit.interrupted(ctx.fiberId())));
            }
        };
        ctx.suspend(onInterrupt);
        stage.whenComplete((value, error) -> {
            Exit<E, A> outcome = error == null ? Exit.succeed(value) : Exit.fail((E) unwrap(error));
            if (channel.offer(outcome)) {
                ctx.leave(onInterrupt);
            }
        });
    }

    private <E extends Throwable, A> void evaluateBlocking(
            Effect.Blocking<?, ?> blocking,
            ExecutionContext ctx,
            Consumer<Exit<E, A>> k
    ) {
        if (ctx.onBlockingThread()) {
            k.accept(runBlocking(blocking, ctx));
            return;
        }
        ctx.<Exit<E, A>>runOnBlocking(
                () -> runBlocking(blocking, ctx),
                exit -> ctx.resume(() -> k.accept(exit))
        );
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable, A> Exit<E, A> runBlocking(
            Effect.Blocking<?, ?> blocking,
            ExecutionContext ctx
    ) {
        if (ctx.isInterruptRequested()) {
            return Exit.interrupted(ctx.fiberId());
        }
        Runnable cancelThunk = blocking.cancelThunk();
        WorkerSignal signal = cancelThunk == null ? new WorkerSignal(Thread.currentThread()) : null;
        Runnable onInterrupt = cancelThunk != null
                ? () -> runHook(cancelThunk, blocking.site(), ctx.fiberId())
                : signal;

        ctx.suspend(onInterrupt);
        try {
            return Exit.succeed((A) blocking.thunk().get());
        } catch (Throwable t) {
            return failOrDie(blocking.site(), t);
        } finally {
            ctx.leave(onInterrupt);
            if (signal != null) {
                signal.finish();
            }
        }
    }

    private <E extends Throwable, A> void evaluateOnBlocking(
            Effect<?, E, A> source,
            ExecutionContext ctx,
            Consumer<Exit<E, A>> k
    ) {
        if (ctx.onBlockingThread()) {
            evaluate(source, ctx, k);
            return;
        }
        ctx.runOnBlocking(() -> evaluate(source, ctx, exit -> ctx.resume(() -> k.accept(exit))));
    }

    @SuppressWarnings("unchecked")
    private <E extends Throwable, A> void evaluateRefine(
            Effect.RefineOrDie<?, ?, ?, ?> refine,
            ExecutionContext ctx,
            Consumer<Exit<E, A>> k
    ) {
        Function<Object, Optional<? extends Throwable>> classifier =
                (Function<Object, Optional<? extends Throwable>>) (Function<?, ?>) refine.classifier();
        Effect<?, Throwable, A> source = (Effect<?, Throwable, A>) (Effect<?, ?, ?>) refine.source();

        evaluate(source, ctx, exit -> {
            if (!(exit instanceof Exit.Failure<Throwable, A> failure)) {
                k.accept((Exit<E, A>) (Exit<?, ?>) exit);
                return;
            }
            Optional<? extends Throwable> narrowed;
            try {
                narrowed = classifier.apply(failure.error());
            } catch (Throwable t) {
                k.accept(Exit.die(refine.site(), t));
                return;
            }
            if (narrowed.isPresent()) {
                k.accept(Exit.fail((E) narrowed.get()));
            } else {
                k.accept(Exit.die(refine.site(), failure.error()));
            }
        });
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable, A> Exit<E, A> failOrDie(ConstructionSite site, Throwable t) {
        if (t instanceof VirtualMachineError) {
            return Exit.die(site, t);
        }
        return Exit.fail((E) t);
    }

    private static Throwable unwrap(Throwable error) {
        if ((error instanceof CompletionException || error instanceof ExecutionException)
                && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static void runHook(Runnable hook, ConstructionSite site, UUID fiberId) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation hook of {} failed for fiber {}", site, fiberId, e);
        }
    }

    // Never signals the worker once its thunk has returned
    private static final class WorkerSignal implements Runnable {
        private final Thread worker;
        private boolean running = true;

        WorkerSignal(Thread worker) {
            this.worker = worker;
        }

        @Override
        public synchronized void run() {
            if (running) {
                worker.interrupt();
            }
        }

        synchronized void finish() {
            running = false;
            Thread.interrupted();
        }
    }
}
