package org.notifkit.dispatch;

import org.notifkit.model.EngineSettings;
import org.notifkit.notifications.error.DispatchRejectedException;
import org.notifkit.notifications.error.OperationTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-thread hand-off point for everything that must run on the dispatch thread (platform calls,
 * listener notification). Producers on any thread post; only the bound thread drains.
 */
public final class MainThreadDispatcher {

    private static final Logger log = LoggerFactory.getLogger(MainThreadDispatcher.class);
    static final int BATCH_SIZE = 16;

    private final Object lock = new Object();
    private final ArrayDeque<Runnable> queue = new ArrayDeque<>();
    private final int capacity;
    private final int maxPerTick;
    private final long tickBudgetNanos;
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong droppedTotal = new AtomicLong();

    private volatile Thread boundThread;
    private boolean closed;

    public MainThreadDispatcher(int capacity, int maxPerTick, Duration tickBudget) {
        if (capacity < 1 || maxPerTick < 1) {
            throw new IllegalArgumentException("capacity and maxPerTick must be positive");
        }
        this.capacity = capacity;
        this.maxPerTick = maxPerTick;
        this.tickBudgetNanos = Objects.requireNonNull(tickBudget, "tickBudget").toNanos();
    }

    public static MainThreadDispatcher from(EngineSettings settings) {
        return new MainThreadDispatcher(settings.dispatcherCapacity(), settings.maxActionsPerTick(),
                settings.tickBudget());
    }

    /**
     * Makes the calling thread the dispatch thread. Until this is called nothing can be drained.
     */
    public void bindToCurrentThread() {
        boundThread = Thread.currentThread();
        log.debug("[Dispatcher] Bound to thread {}", boundThread.getName());
    }

    public boolean isBound() {
        return boundThread != null;
    }

    public boolean isDispatchThread() {
        return Thread.currentThread() == boundThread;
    }

    public int capacity() {
        return capacity;
    }

    public boolean post(Runnable action) {
        return post(action, true);
    }

    /**
     * Enqueues {@code action}. When the queue is full, either the oldest pending action is dropped
     * to make room or the new one is refused.
     *
     * @return false if the action was not admitted
     */
    public boolean post(Runnable action, boolean dropOldestIfFull) {
        Objects.requireNonNull(action, "action");
        synchronized (lock) {
            if (closed) {
                return false;
            }
            if (queue.size() >= capacity) {
                dropped.incrementAndGet();
                droppedTotal.incrementAndGet();
                if (!dropOldestIfFull) {
                    log.warn("[Dispatcher] Queue full ({}), rejecting action", capacity);
                    return false;
                }
                queue.pollFirst();
                log.warn("[Dispatcher] Queue full ({}), dropped oldest action", capacity);
            }
            queue.addLast(action);
            return true;
        }
    }

    /**
     * Runs pending actions in batches until the queue is empty, the per-tick action limit is reached
     * or the time budget is spent. Must be called on the bound thread.
     *
     * @return number of actions executed
     */
    public int drain() {
        if (!isDispatchThread()) {
            throw new IllegalStateException("drain() called off the dispatch thread: "
                    + Thread.currentThread().getName());
        }
        long start = System.nanoTime();
        int executed = 0;
        Runnable[] batch = new Runnable[BATCH_SIZE];
        while (executed < maxPerTick) {
            int n;
            synchronized (lock) {
                int want = Math.min(BATCH_SIZE, maxPerTick - executed);
                n = 0;
                while (n < want && !queue.isEmpty()) {
                    batch[n++] = queue.pollFirst();
                }
            }
            if (n == 0) {
                break;
            }
            for (int i = 0; i < n; i++) {
                Runnable action = batch[i];
                batch[i] = null;
                try {
                    action.run();
                } catch (RuntimeException ex) {
                    log.error("[Dispatcher] Action failed", ex);
                }
            }
            executed += n;
            if (System.nanoTime() - start >= tickBudgetNanos) {
                break;
            }
        }
        return executed;
    }

    /**
     * Runs {@code work} on the dispatch thread and exposes its outcome as a future.
     * <ul>
     *   <li>queue full: the future fails at once with {@link DispatchRejectedException}</li>
     *   <li>no result within {@code timeout}: {@link OperationTimeoutException}</li>
     *   <li>{@code signal} canceled: the future is canceled</li>
     * </ul>
     * Work that has already started runs to completion; work whose future completed before it
     * started is skipped. On the dispatch thread the work runs inline.
     */
    public <T> CompletableFuture<T> submit(String operation, Callable<T> work, CancellationSignal signal,
                                           Duration timeout) {
        Objects.requireNonNull(work, "work");
        CompletableFuture<T> future = new CompletableFuture<>();
        if (signal != null && signal.isCanceled()) {
            future.cancel(false);
            return future;
        }
        if (isDispatchThread()) {
            runInto(operation, work, future);
            return future;
        }
        Runnable task = () -> {
            if (future.isDone()) {
                log.debug("[Dispatcher] Skipping {}, caller no longer waiting", operation);
                return;
            }
            runInto(operation, work, future);
        };
        if (!post(task, false)) {
            future.completeExceptionally(new DispatchRejectedException(capacity));
            return future;
        }
        return guard(operation, future, signal, timeout);
    }

    /**
     * Ties {@code future} to a cancellation signal and a deadline: canceling the signal cancels the
     * future, and a future still incomplete after {@code timeout} fails with
     * {@link OperationTimeoutException}.
     */
    public <T> CompletableFuture<T> guard(String operation, CompletableFuture<T> future, CancellationSignal signal,
                                          Duration timeout) {
        if (signal != null) {
            signal.setOnCancelListener(() -> future.cancel(false));
            future.whenComplete((r, e) -> signal.setOnCancelListener(null));
        }
        if (timeout != null && !timeout.isNegative() && !timeout.isZero() && !future.isDone()) {
            CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS).execute(() -> {
                if (future.completeExceptionally(new OperationTimeoutException(operation, timeout))) {
                    log.warn("[Dispatcher] {} timed out after {} ms", operation, timeout.toMillis());
                }
            });
        }
        return future;
    }

    /**
     * Runs {@code action} now when already on the dispatch thread, otherwise posts it.
     */
    public boolean execute(Runnable action) {
        if (isDispatchThread()) {
            action.run();
            return true;
        }
        return post(action);
    }

    public int pendingCount() {
        synchronized (lock) {
            return queue.size();
        }
    }

    /**
     * @return drops and rejections since the last call
     */
    public long drainDropped() {
        return dropped.getAndSet(0);
    }

    public long droppedTotal() {
        return droppedTotal.get();
    }

    /**
     * Refuses further posts and discards what is pending.
     */
    public void close() {
        int discarded;
        synchronized (lock) {
            closed = true;
            discarded = queue.size();
            queue.clear();
        }
        if (discarded > 0) {
            log.info("[Dispatcher] Closed with {} pending actions discarded", discarded);
        }
    }

    private static <T> void runInto(String operation, Callable<T> work, CompletableFuture<T> future) {
        try {
            future.complete(work.call());
        } catch (Exception ex) {
            log.debug("[Dispatcher] {} failed: {}", operation, ex.getMessage());
            future.completeExceptionally(ex);
        }
    }
}
