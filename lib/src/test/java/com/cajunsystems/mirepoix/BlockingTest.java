package com.cajunsystems.mirepoix;

import com.cajunsystems.mirepoix.data.Unit;
import com.cajunsystems.mirepoix.exception.DefectException;
import com.cajunsystems.mirepoix.runtime.DefaultEffectRuntime;
import com.cajunsystems.mirepoix.runtime.RuntimeConfig;
import com.cajunsystems.mirepoix.runtime.RuntimePools;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class BlockingTest {
    private final EffectRuntime runtime = DefaultEffectRuntime.create(
            RuntimeConfig.defaults().withComputationThreads(2)
    );

    @AfterEach
    void tearDown() {
        runtime.close();
    }

    @Test
    void testEffectBlockingRunsOnBlockingPool() throws Throwable {
        Effect<Unit, Throwable, Thread> effect = Effect.effectBlocking(Thread::currentThread);

        Thread worker = runtime.unsafeRun(effect);

        assertTrue(runtime.pools().isBlockingThread(worker));
        assertFalse(runtime.pools().isComputationThread(worker));
        assertTrue(worker.getName().startsWith("mirepoix-blocking-"));
    }

    @Test
    void testPlainEffectRunsOnComputationPool() throws Throwable {
        Effect<Unit, Throwable, Thread> effect = Effect.effect(Thread::currentThread);

        Thread worker = runtime.unsafeRun(effect);

        assertTrue(runtime.pools().isComputationThread(worker));
        assertFalse(runtime.pools().isBlockingThread(worker));
    }

    @Test
    void testBlockingRelocatesWrappedEffect() throws Throwable {
        Effect<Unit, RuntimeException, Thread> onComputation = Effect.effectTotal(Thread::currentThread);
        Effect<Unit, RuntimeException, Thread> relocated = Effect.blocking(onComputation);

        Thread worker = runtime.unsafeRun(relocated);

        assertTrue(runtime.pools().isBlockingThread(worker));
        assertFalse(runtime.pools().isComputationThread(worker));
    }

    @Test
    void testBlockingKeepsTypedFailure() {
        IOException error = new IOException("slow disk");
        Effect<Unit, Throwable, String> relocated = Effect.blocking(Effect.effect(() -> {
            throw error;
        }));

        Exit<Throwable, String> exit = runtime.unsafeRunExit(relocated, Unit.unit());

        assertInstanceOf(Exit.Failure.class, exit);
        assertSame(error, ((Exit.Failure<Throwable, String>) exit).error());
    }

    @Test
    void testBlockingOfBlockingNodeIsUnchanged() {
        Effect<Unit, Throwable, String> blockingNode = Effect.effectBlocking(() -> "io");
        Effect<Unit, Throwable, String> wrapped = Effect.blocking(Effect.effect(() -> "io"));

        assertSame(blockingNode, Effect.blocking(blockingNode));
        assertSame(wrapped, Effect.blocking(wrapped));
    }

    @Test
    void testNestedBlockingRunsInPlace() throws Throwable {
        Effect<Unit, Throwable, Thread> inner = Effect.effectBlocking(Thread::currentThread);
        Effect<Unit, Throwable, Thread> outer = Effect.blocking(inner.refineToOrDie(Throwable.class));

        Thread worker = runtime.unsafeRun(outer);

        assertTrue(runtime.pools().isBlockingThread(worker));
    }

    @Test
    void testEffectBlockingFailure() {
        Effect<Unit, Throwable, String> effect = Effect.effectBlocking(() -> {
            throw new IOException("socket closed");
        });

        IOException thrown = assertThrows(IOException.class, () -> runtime.unsafeRun(effect));
        assertEquals("socket closed", thrown.getMessage());
    }

    @Test
    void testCancelableBlockingInterruptInvokesCancelThunkOnce() throws Exception {
        RuntimePools pools = runtime.pools();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger cancels = new AtomicInteger(0);
        AtomicBoolean returned = new AtomicBoolean(false);

        Effect<Unit, Throwable, String> effect = Effect.effectBlockingCancelable(() -> {
            started.countDown();
            release.await();
            returned.set(true);
            return "finished";
        }, () -> {
            cancels.incrementAndGet();
            release.countDown();
        });

        int baseline = pools.busyBlockingThreads();
        Fiber<Throwable, String> fiber = runtime.fork(effect);
        assertTrue(started.await(2, TimeUnit.SECONDS));
        assertEquals(baseline + 1, pools.busyBlockingThreads());

        fiber.interrupt();
        fiber.interrupt();
        Optional<Exit<Throwable, String>> exit = fiber.await(Duration.ofSeconds(2));

        assertTrue(exit.isPresent());
        assertTrue(exit.get().isInterrupted());
        assertEquals(1, cancels.get());
        assertTrue(returned.get());
        assertEquals(baseline, pools.busyBlockingThreads());
    }

    @Test
    void testCancelThunkIsNotRunWithoutInterruption() throws Throwable {
        AtomicInteger cancels = new AtomicInteger(0);
        Effect<Unit, Throwable, String> effect = Effect.effectBlockingCancelable(
                () -> "quick",
                cancels::incrementAndGet
        );

        assertEquals("quick", runtime.unsafeRun(effect));
        assertEquals(0, cancels.get());
    }

    @Test
    void testUncancelableBlockingInterruptSignalsWorker() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean sawInterrupt = new AtomicBoolean(false);

        Effect<Unit, Throwable, String> effect = Effect.effectBlocking(() -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
                return "slept";
            } catch (InterruptedException e) {
                sawInterrupt.set(true);
                throw e;
            }
        });

        Fiber<Throwable, String> fiber = runtime.fork(effect);
        assertTrue(started.await(2, TimeUnit.SECONDS));

        fiber.interrupt();
        Optional<Exit<Throwable, String>> exit = fiber.await(Duration.ofSeconds(5));

        assertTrue(exit.isPresent());
        assertTrue(exit.get().isInterrupted());
        assertTrue(sawInterrupt.get());
    }

    @Test
    void testUncancelableBlockingWaitsForThunk() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Effect<Unit, Throwable, String> effect = Effect.effectBlocking(() -> {
            started.countDown();
            awaitUninterruptibly(release);
            return "done";
        });

        Fiber<Throwable, String> fiber = runtime.fork(effect);
        assertTrue(started.await(2, TimeUnit.SECONDS));

        fiber.interrupt();
        assertTrue(fiber.await(Duration.ofMillis(200)).isEmpty());

        release.countDown();
        assertTrue(fiber.await().isInterrupted());
    }

    @Test
    void testWorkerInterruptFlagDoesNotLeak() throws Throwable {
        Effect<Unit, Throwable, Boolean> interruptFlag = Effect.effectBlocking(() -> Thread.currentThread().isInterrupted());

        for (int i = 0; i < 5; i++) {
            assertFalse(runtime.unsafeRun(interruptFlag));
        }
    }

    @Test
    void testBlockingWorkQueuedBehindCloseIsDefect() throws Exception {
        EffectRuntime single = DefaultEffectRuntime.create(RuntimeConfig.defaults().withComputationThreads(1));
        CountDownLatch occupied = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Effect<Unit, Throwable, String> busy = Effect.effectTotal(() -> {
            occupied.countDown();
            awaitUninterruptibly(release);
            return "busy";
        });
        Effect<Unit, Throwable, String> direct = Effect.effectBlocking(() -> "io");
        Effect<Unit, Throwable, String> relocated = Effect.blocking(Effect.effect(() -> "io"));

        single.fork(busy);
        assertTrue(occupied.await(2, TimeUnit.SECONDS));
        Fiber<Throwable, String> directFiber = single.fork(direct);
        Fiber<Throwable, String> relocatedFiber = single.fork(relocated);

        Thread closer = new Thread(single::close, "closer");
        closer.start();
        assertTrue(eventually(() -> single.pools().blocking().isShutdown()));
        release.countDown();

        for (Fiber<Throwable, String> fiber : List.of(directFiber, relocatedFiber)) {
            Optional<Exit<Throwable, String>> exit = fiber.await(Duration.ofSeconds(3));
            assertTrue(exit.isPresent());
            assertInstanceOf(Exit.Die.class, exit.get());
            DefectException defect = ((Exit.Die<Throwable, String>) exit.get()).defect();
            assertEquals("runOnBlocking", defect.site().operation());
            assertInstanceOf(RejectedExecutionException.class, defect.getCause());
        }
        closer.join(5_000);
        assertTrue(single.pools().isClosed());
    }

    private static boolean eventually(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(10);
        }
        return true;
    }

    private static void awaitUninterruptibly(CountDownLatch latch) {
        boolean interrupted = false;
        while (true) {
            try {
                latch.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
