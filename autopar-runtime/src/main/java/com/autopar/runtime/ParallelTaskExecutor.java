package com.autopar.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Runs the work units of one parallel task on a bounded pool.
 *
 * Up to {@code workers} drainer tasks pull unit indexes from a shared cursor over the
 * submission order, so completion order is arbitrary; outcomes come back indexed so the
 * caller can combine them in iteration order. A task started from inside a worker runs
 * its units inline in index order instead of waiting on the pool it is occupying.
 */
public final class ParallelTaskExecutor implements AutoCloseable {

    /** One unit's body. {@code partial} receives anything the unit produced before it failed. */
    @FunctionalInterface
    public interface UnitBody<T> {
        T run(int index, Partial<T> partial);
    }

    /** Holder for a unit's intermediate result, kept when the unit throws. */
    public static final class Partial<T> {
        private T value;

        public void set(T value) {
            this.value = value;
        }

        T get() {
            return value;
        }
    }

    private static final ThreadLocal<Boolean> IN_WORKER = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private final int maxWorkers;
    private final SubmissionOrder order;
    private final ExecutorService pool;

    public ParallelTaskExecutor(int maxWorkers, SubmissionOrder order) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1, got " + maxWorkers);
        }
        this.maxWorkers = maxWorkers;
        this.order = order;
        this.pool = Executors.newFixedThreadPool(maxWorkers, new WorkerFactory());
    }

    public ParallelTaskExecutor(int maxWorkers) {
        this(maxWorkers, SubmissionOrder.sequential());
    }

    public int maxWorkers() {
        return maxWorkers;
    }

    public SubmissionOrder order() {
        return order;
    }

    /**
     * Runs {@code units} units on at most {@code workers} threads and returns one
     * outcome per unit, in index order.
     */
    public <T> List<UnitOutcome<T>> execute(int units, int workers, UnitBody<T> body) {
        if (units == 0) return List.of();
        if (IN_WORKER.get() || workers <= 1 && units == 1) {
            return inline(units, body);
        }
        int[] permutation = order.permutation(units);
        AtomicInteger cursor = new AtomicInteger();
        AtomicInteger lowestFailure = new AtomicInteger(Integer.MAX_VALUE);
        AtomicReferenceArray<UnitOutcome<T>> outcomes = new AtomicReferenceArray<>(units);

        Runnable drainer = () -> {
            IN_WORKER.set(Boolean.TRUE);
            try {
                for (int p = cursor.getAndIncrement(); p < units; p = cursor.getAndIncrement()) {
                    int index = permutation[p];
                    if (index > lowestFailure.get()) {
                        outcomes.set(index, UnitOutcome.skip(index));
                        continue;
                    }
                    UnitOutcome<T> outcome = runOne(index, body);
                    if (outcome.isFailure()) {
                        lowestFailure.accumulateAndGet(index, Math::min);
                    }
                    outcomes.set(index, outcome);
                }
            } finally {
                IN_WORKER.set(Boolean.FALSE);
            }
        };

        int drainers = Math.max(1, Math.min(Math.min(workers, maxWorkers), units));
        List<Future<?>> futures = new ArrayList<>(drainers);
        for (int k = 0; k < drainers; k++) {
            futures.add(pool.submit(drainer));
        }
        for (Future<?> f : futures) {
            await(f);
        }

        List<UnitOutcome<T>> out = new ArrayList<>(units);
        for (int k = 0; k < units; k++) {
            out.add(outcomes.get(k));
        }
        return out;
    }

    private static <T> List<UnitOutcome<T>> inline(int units, UnitBody<T> body) {
        List<UnitOutcome<T>> out = new ArrayList<>(units);
        boolean failed = false;
        for (int k = 0; k < units; k++) {
            if (failed) {
                out.add(UnitOutcome.skip(k));
                continue;
            }
            UnitOutcome<T> outcome = runOne(k, body);
            failed = outcome.isFailure();
            out.add(outcome);
        }
        return out;
    }

    private static <T> UnitOutcome<T> runOne(int index, UnitBody<T> body) {
        Partial<T> partial = new Partial<>();
        try {
            return UnitOutcome.done(index, body.run(index, partial));
        } catch (RuntimeException e) {
            return UnitOutcome.failed(index, partial.get(), e);
        }
    }

    private static void await(Future<?> future) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for work units", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("Work unit drainer failed", cause);
        }
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "autopar-worker-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
