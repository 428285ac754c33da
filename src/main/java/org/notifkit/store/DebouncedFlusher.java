package org.notifkit.store;

import org.notifkit.notifications.error.PersistenceException;
import org.notifkit.resilience.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Coalesces state changes into snapshot writes. Every {@link #markDirty()} pushes the write back by
 * the debounce window; the write itself runs on a dedicated thread, off the dispatch thread.
 * While the circuit breaker is open, writes are skipped and the state stays dirty.
 */
public final class DebouncedFlusher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DebouncedFlusher.class);

    public interface Listener {
        void onSaved(long elapsedNanos);

        void onFailed(PersistenceException error);
    }

    private final SnapshotStore store;
    private final Supplier<NotificationSnapshot> capture;
    private final CircuitBreaker breaker;
    private final Duration debounce;
    private final Listener listener;
    private final ScheduledExecutorService executor;
    private final AtomicBoolean dirty = new AtomicBoolean();
    private final Object flushLock = new Object();
    private final Object timerLock = new Object();
    private ScheduledFuture<?> pendingFlush;

    public DebouncedFlusher(SnapshotStore store,
                            Supplier<NotificationSnapshot> capture,
                            CircuitBreaker breaker,
                            Duration debounce,
                            Listener listener) {
        this.store = Objects.requireNonNull(store, "store");
        this.capture = Objects.requireNonNull(capture, "capture");
        this.breaker = Objects.requireNonNull(breaker, "breaker");
        this.debounce = Objects.requireNonNull(debounce, "debounce");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "notifkit-store");
            t.setDaemon(true);
            return t;
        });
    }

    public boolean isDirty() {
        return dirty.get();
    }

    public void markDirty() {
        dirty.set(true);
        synchronized (timerLock) {
            if (pendingFlush != null) {
                pendingFlush.cancel(false);
            }
            try {
                pendingFlush = executor.schedule(this::flushNow, debounce.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException ex) {
                log.debug("[DebouncedFlusher] Closed, dirty state kept for the shutdown flush");
            }
        }
    }

    /**
     * Re-arms the debounce when a write was skipped earlier, typically right after the breaker
     * closed.
     */
    public void resumeIfDirty() {
        if (dirty.get()) {
            markDirty();
        }
    }

    /**
     * Writes now if there is anything to write and the breaker allows it.
     *
     * @return true if a snapshot was written
     */
    public boolean flushNow() {
        return flush(false);
    }

    /**
     * Writes even when nothing changed since the last write.
     */
    public Future<Boolean> forceFlush() {
        dirty.set(true);
        return executor.submit(this::flushNow);
    }

    /**
     * Cancels the debounce and makes a final write on the store thread, waiting at most
     * {@code budget}. The breaker is not consulted: this is the last chance to persist.
     *
     * @return true if the state reached disk within the budget
     */
    public boolean flushOnShutdown(Duration budget) {
        synchronized (timerLock) {
            if (pendingFlush != null) {
                pendingFlush.cancel(false);
                pendingFlush = null;
            }
        }
        if (!dirty.get()) {
            return true;
        }
        Future<Boolean> result;
        try {
            result = executor.submit(() -> flush(true));
        } catch (RejectedExecutionException ex) {
            return flush(true);
        }
        try {
            return result.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            log.warn("[DebouncedFlusher] Shutdown flush did not finish within {} ms", budget.toMillis());
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException ex) {
            log.error("[DebouncedFlusher] Shutdown flush failed", ex.getCause());
            return false;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private boolean flush(boolean ignoreBreaker) {
        synchronized (flushLock) {
            if (!dirty.get()) {
                return false;
            }
            if (!ignoreBreaker && breaker.isOpen()) {
                log.debug("[DebouncedFlusher] Breaker open, save skipped");
                return false;
            }
            dirty.set(false);
            NotificationSnapshot snapshot;
            try {
                snapshot = capture.get();
            } catch (RuntimeException ex) {
                dirty.set(true);
                log.error("[DebouncedFlusher] Unable to capture state", ex);
                return false;
            }
            long start = System.nanoTime();
            try {
                store.save(snapshot);
            } catch (PersistenceException ex) {
                dirty.set(true);
                breaker.recordError();
                log.warn("[DebouncedFlusher] Save failed: {}", ex.getMessage(), ex);
                listener.onFailed(ex);
                return false;
            }
            breaker.recordSuccess();
            listener.onSaved(System.nanoTime() - start);
            return true;
        }
    }
}
