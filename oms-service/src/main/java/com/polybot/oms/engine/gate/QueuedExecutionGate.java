package com.polybot.oms.engine.gate;

import com.polybot.oms.trading.GateCancellationException;
import com.polybot.oms.trading.QueueClosedException;
import com.polybot.oms.trading.TradingException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Serializes every order-mutating call (place, cancel, multi-leg) through one worker thread.
 *
 * Consecutive writes are spaced by at least {@code minInterval}. A request that has been admitted to the backlog
 * always runs, even if its caller has stopped waiting. Reads never go through the gate.
 */
@Slf4j
public class QueuedExecutionGate implements AutoCloseable {

    private static final long POLL_MILLIS = 50;

    private final BlockingQueue<Task<?>> backlog;
    private final long minIntervalNanos;
    private final ExecutorService worker;

    private volatile boolean closed;
    private volatile Task<?> inFlight;

    public QueuedExecutionGate(int capacity, Duration minInterval) {
        this.backlog = new ArrayBlockingQueue<>(capacity <= 0 ? 128 : capacity);
        this.minIntervalNanos = minInterval == null || minInterval.isNegative() ? 0 : minInterval.toNanos();
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "oms-trading-gate");
            t.setDaemon(true);
            return t;
        });
        this.worker.execute(this::drain);
    }

    /**
     * Runs {@code work} on the gate's worker and waits for its result.
     *
     * @param timeout bound on the wait for admission plus completion
     * @throws QueueClosedException when the gate is, or gets, closed
     * @throws GateCancellationException when the wait times out or the calling thread is interrupted
     */
    public <T> T submit(String operation, Callable<T> work, Duration timeout) {
        if (closed) {
            throw new QueueClosedException();
        }
        Task<T> task = new Task<>(operation, work);
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            if (!backlog.offer(task, timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new GateCancellationException(operation + " not admitted within " + timeout.toMillis() + "ms", null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GateCancellationException(operation + " interrupted before admission", e);
        }
        if (closed && backlog.remove(task)) {
            throw new QueueClosedException();
        }

        try {
            long remaining = Math.max(0, deadline - System.nanoTime());
            return task.result.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new GateCancellationException(operation + " did not complete within " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GateCancellationException(operation + " interrupted while waiting", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new TradingException(operation + " failed", cause);
        }
    }

    public <T> T submit(String operation, Callable<T> work) {
        return submit(operation, work, Duration.ofSeconds(10));
    }

    public int queueLength() {
        return backlog.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stops the worker. Waiting callers, queued or in flight, fail with {@link QueueClosedException}.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        List<Task<?>> abandoned = new ArrayList<>();
        backlog.drainTo(abandoned);
        Task<?> current = inFlight;
        if (current != null) {
            abandoned.add(current);
        }
        for (Task<?> task : abandoned) {
            task.result.completeExceptionally(new QueueClosedException());
        }
        worker.shutdown();
        log.info("trading gate closed ({} pending requests abandoned)", abandoned.size());
    }

    private void drain() {
        long lastWriteNanos = 0;
        boolean wrote = false;
        while (!closed) {
            Task<?> task;
            try {
                task = backlog.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (task == null) {
                continue;
            }
            if (minIntervalNanos > 0 && wrote) {
                long sleepNanos = minIntervalNanos - (System.nanoTime() - lastWriteNanos);
                if (sleepNanos > 0) {
                    try {
                        TimeUnit.NANOSECONDS.sleep(sleepNanos);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        task.result.completeExceptionally(new QueueClosedException());
                        return;
                    }
                }
            }
            if (closed) {
                task.result.completeExceptionally(new QueueClosedException());
                return;
            }
            inFlight = task;
            try {
                task.run();
            } finally {
                inFlight = null;
                lastWriteNanos = System.nanoTime();
                wrote = true;
            }
        }
    }

    private static final class Task<T> {
        private final String operation;
        private final Callable<T> work;
        private final CompletableFuture<T> result = new CompletableFuture<>();

        private Task(String operation, Callable<T> work) {
            this.operation = operation;
            this.work = work;
        }

        private void run() {
            try {
                result.complete(work.call());
            } catch (Exception e) {
                log.debug("gated {} failed: {}", operation, e.getMessage());
                result.completeExceptionally(e);
            }
        }
    }
}
