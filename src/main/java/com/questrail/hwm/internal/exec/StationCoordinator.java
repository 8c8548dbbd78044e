package com.questrail.hwm.internal.exec;

import com.questrail.hwm.internal.time.SystemWallClock;
import com.questrail.hwm.observability.NullObservabilitySink;
import com.questrail.hwm.observability.StationErrorEvent;
import com.questrail.hwm.observability.StationObservabilitySink;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * StationCoordinator
 * =============================================================================
 * Serialized event loop that owns every device and pipeline state transition.
 *
 * <h2>Threading Model</h2>
 * The coordinator runs a single event-processing thread. Tasks are submitted to
 * a queue and processed sequentially. This ensures:
 * <ul>
 *   <li>No concurrent modification of device or pipeline state</li>
 *   <li>Pipeline reservation never interleaves with another reservation</li>
 *   <li>Deterministic ordering of submitted work</li>
 * </ul>
 *
 * Command bodies do NOT run here; the command parser hands them to a worker
 * pool and only returns to the coordinator to build the response.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   coordinator.start()        → starts event loop thread
 *   coordinator.submit(...)    → enqueues a task, returns its future
 *   coordinator.stop()         → stops the event loop
 * </pre>
 *
 * Futures returned by {@link #submit(Callable)} always complete: work still
 * queued when the loop stops completes exceptionally with
 * {@link RejectedExecutionException}.
 */
public final class StationCoordinator implements Executor {

    private final StationObservabilitySink observabilitySink;
    private final BlockingQueue<Runnable> taskQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Thread eventLoopThread;

    public StationCoordinator(StationObservabilitySink observabilitySink) {
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public StationCoordinator() {
        this(null);
    }

    /**
     * Starts the event loop thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            eventLoopThread = new Thread(this::runEventLoop, "hwm-coordinator");
            eventLoopThread.setDaemon(true);
            eventLoopThread.start();
        }
    }

    /**
     * Stops the event loop thread and rejects every task still queued.
     * Blocks until the event loop thread terminates.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread t = eventLoopThread;
            if (t != null) {
                t.interrupt();
                if (t != Thread.currentThread()) {
                    try {
                        t.join(5000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }
            List<Runnable> pending = new ArrayList<>();
            taskQueue.drainTo(pending);
            pending.forEach(StationCoordinator::reject);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Returns {@code true} when called from the event loop thread.
     */
    public boolean inEventLoop() {
        return Thread.currentThread() == eventLoopThread;
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        if (!running.get()) {
            throw new RejectedExecutionException("Station coordinator is not running");
        }
        taskQueue.offer(task);
        // stop() may have drained the queue between the check and the offer
        if (!running.get() && taskQueue.remove(task)) {
            throw new RejectedExecutionException("Station coordinator is not running");
        }
    }

    /**
     * Submits a task for serialized execution.
     *
     * @return a future completed with the task's result, or exceptionally with
     *         whatever the task threw
     */
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        Objects.requireNonNull(task, "task");
        SubmittedTask<T> submitted = new SubmittedTask<>(task);
        try {
            execute(submitted);
        } catch (RejectedExecutionException e) {
            submitted.future.completeExceptionally(e);
        }
        return submitted.future;
    }

    /**
     * Main event loop - runs on dedicated thread.
     */
    private void runEventLoop() {
        while (running.get()) {
            try {
                Runnable task = taskQueue.take();
                if (running.get()) {
                    task.run();
                } else {
                    reject(task);
                }
            } catch (InterruptedException e) {
                // stop() clears running before interrupting; any other interrupt is ignored
            } catch (Exception e) {
                observabilitySink.onError(new StationErrorEvent(
                    SystemWallClock.INSTANCE.now(),
                    "Coordinator task failed",
                    e
                ));
            }
        }
    }

    private static void reject(Runnable task) {
        if (task instanceof SubmittedTask<?> submitted) {
            submitted.future.completeExceptionally(
                new RejectedExecutionException("Station coordinator stopped before the task ran"));
        }
    }

    /**
     * Queued form of {@link #submit(Callable)}; keeps the future so a stop can reject it.
     */
    private static final class SubmittedTask<T> implements Runnable {
        private final Callable<T> task;
        private final CompletableFuture<T> future = new CompletableFuture<>();

        private SubmittedTask(Callable<T> task) {
            this.task = task;
        }

        @Override
        public void run() {
            try {
                future.complete(task.call());
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        }
    }
}
