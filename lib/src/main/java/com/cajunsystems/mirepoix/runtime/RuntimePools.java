package com.cajunsystems.mirepoix.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

public final class RuntimePools implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RuntimePools.class);

    private static volatile RuntimePools shared;

    private final RuntimeConfig config;
    private final ThreadPoolExecutor computation;
    private final ThreadPoolExecutor blocking;
    private final Set<Thread> computationThreads = ConcurrentHashMap.newKeySet();
    private final Set<Thread> blockingThreads = ConcurrentHashMap.newKeySet();
    private final AtomicInteger busyBlocking = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private RuntimePools(RuntimeConfig config) {
        this.config = config;
        this.computation = new ThreadPoolExecutor(
                config.computationThreads(),
                config.computationThreads(),
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                trackingFactory(config.threadNamePrefix() + "-computation-", computationThreads)
        );
        this.blocking = new ThreadPoolExecutor(
                0,
                Integer.MAX_VALUE,
                config.blockingKeepAlive().toMillis(), TimeUnit.MILLISECONDS,
                new SynchronousQueue<>(),
                trackingFactory(config.threadNamePrefix() + "-blocking-", blockingThreads)
        );
    }

    public static RuntimePools create(RuntimeConfig config) {
        RuntimePools pools = new RuntimePools(config);
        log.info("Created runtime pools: {} computation threads, blocking keep-alive {}",
                config.computationThreads(), config.blockingKeepAlive());
        return pools;
    }

    /**
     * The process-wide pools, created from system properties on first use and drained
     * by a shutdown hook when the JVM exits.
     */
    public static RuntimePools shared() {
        RuntimePools pools = shared;
        if (pools == null) {
            synchronized (RuntimePools.class) {
                pools = shared;
                if (pools == null) {
                    pools = create(RuntimeConfig.fromSystemProperties());
                    Thread hook = new Thread(pools::close, pools.config.threadNamePrefix() + "-drain");
                    Runtime.getRuntime().addShutdownHook(hook);
                    shared = pools;
                }
            }
        }
        return pools;
    }

    public RuntimeConfig config() {
        return config;
    }

    public ExecutorService computation() {
        return computation;
    }

    public ExecutorService blocking() {
        return blocking;
    }

    public void executeComputation(Runnable task) {
        computation.execute(task);
    }

    public void executeBlocking(Runnable task) {
        blocking.execute(() -> {
            busyBlocking.incrementAndGet();
            try {
                task.run();
            } finally {
                busyBlocking.decrementAndGet();
            }
        });
    }

    // then runs after the worker is counted idle again
    public <T> void executeBlocking(Supplier<? extends T> work, Consumer<? super T> then) {
        blocking.execute(() -> {
            T result;
            busyBlocking.incrementAndGet();
            try {
                result = work.get();
            } finally {
                busyBlocking.decrementAndGet();
            }
            then.accept(result);
        });
    }

    public boolean isComputationThread(Thread thread) {
        return computationThreads.contains(thread);
    }

    public boolean isBlockingThread(Thread thread) {
        return blockingThreads.contains(thread);
    }

    public int busyBlockingThreads() {
        return busyBlocking.get();
    }

    public int liveBlockingThreads() {
        return blockingThreads.size();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        computation.shutdown();
        blocking.shutdown();
        drain("computation", computation);
        drain("blocking", blocking);
        log.info("Runtime pools closed");
    }

    private void drain(String name, ExecutorService pool) {
        try {
            if (!pool.awaitTermination(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("The {} pool did not drain within {}, forcing shutdown", name, config.shutdownTimeout());
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    private static ThreadFactory trackingFactory(String prefix, Set<Thread> members) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(() -> {
                members.add(Thread.currentThread());
                try {
                    runnable.run();
                } finally {
                    members.remove(Thread.currentThread());
                }
            }, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
