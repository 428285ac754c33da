package org.notifkit.notifications;

import org.notifkit.dispatch.CancellationSignal;
import org.notifkit.dispatch.MainThreadDispatcher;
import org.notifkit.index.GroupRegistry;
import org.notifkit.index.ScheduleIndex;
import org.notifkit.model.ChannelConfig;
import org.notifkit.model.EngineSettings;
import org.notifkit.model.NotificationDescriptor;
import org.notifkit.model.NotificationEvent;
import org.notifkit.model.NotificationStatus;
import org.notifkit.model.PerformanceMetrics;
import org.notifkit.model.RepeatInterval;
import org.notifkit.model.ReturnNotificationConfig;
import org.notifkit.notifications.error.CapacityExceededException;
import org.notifkit.notifications.error.CircuitOpenException;
import org.notifkit.notifications.error.NotificationException;
import org.notifkit.notifications.error.PersistenceException;
import org.notifkit.notifications.error.PlatformException;
import org.notifkit.notifications.error.ValidationException;
import org.notifkit.platform.DeliveryListener;
import org.notifkit.platform.PlatformAdapter;
import org.notifkit.policy.NotificationCommands;
import org.notifkit.policy.ReturnNotificationPolicy;
import org.notifkit.pool.ObjectPool;
import org.notifkit.resilience.CircuitBreaker;
import org.notifkit.store.DebouncedFlusher;
import org.notifkit.store.NotificationSnapshot;
import org.notifkit.store.SnapshotEntry;
import org.notifkit.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Local notification engine. Owns the schedule index, the persistence pipeline and the return
 * notification policy, and funnels every platform call through a single dispatch thread.
 * <p>
 * Lifecycle: {@link #initialize()} restores persisted state, {@link #start()} launches the
 * "notifications-runner" thread that drains the dispatcher, {@link #close()} flushes and stops.
 * Synchronous methods report failures as {@code false}/empty values; the {@code *Async} variants
 * complete their future with a {@link NotificationException} subtype.
 */
public final class NotificationService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final EngineSettings settings;
    private final PlatformAdapter platform;
    private final Clock clock;
    private final GroupRegistry groups = new GroupRegistry();
    private final ScheduleIndex index;
    private final CircuitBreaker breaker;
    private final MainThreadDispatcher dispatcher;
    private final ObjectPool<NotificationDescriptor> descriptorPool;
    private final ObjectPool<NotificationEvent> eventPool;
    private final NotificationEvents events;
    private final EngineMetrics metrics;
    private final SnapshotStore store;
    private final DebouncedFlusher flusher;
    private final ReturnNotificationPolicy returnPolicy;
    private final AtomicBoolean initialized = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile ScheduledExecutorService runner;
    private volatile ChannelConfig channel = ChannelConfig.defaults();
    private volatile Instant lastMetricsFlush;

    public NotificationService(EngineSettings settings, PlatformAdapter platform, SnapshotStore store, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings").normalized();
        this.platform = Objects.requireNonNull(platform, "platform");
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.index = new ScheduleIndex(this.settings.maxTracked(), groups);
        this.breaker = new CircuitBreaker(this.settings.breakerThreshold(), this.settings.breakerCooldown(),
                this.settings.breakerCheckInterval(), clock);
        this.dispatcher = MainThreadDispatcher.from(this.settings);
        this.descriptorPool = new ObjectPool<>("descriptors", this.settings.descriptorPoolSize(),
                NotificationDescriptor::new);
        this.eventPool = new ObjectPool<>("events", this.settings.eventPoolSize(), NotificationEvent::new);
        this.events = new NotificationEvents(eventPool, clock);
        this.metrics = new EngineMetrics(clock);
        this.returnPolicy = new ReturnNotificationPolicy(new EngineCommands(), clock);
        this.flusher = new DebouncedFlusher(store, this::captureSnapshot, breaker, this.settings.saveDebounce(),
                new DebouncedFlusher.Listener() {
                    @Override
                    public void onSaved(long elapsedNanos) {
                        metrics.recordSave(elapsedNanos);
                    }

                    @Override
                    public void onFailed(PersistenceException error) {
                        metrics.recordError();
                        dispatcher.post(() -> events.publishError("save", error));
                    }
                });
        this.lastMetricsFlush = clock.instant();
    }

    // ------------------------------------------------------------------ lifecycle

    /**
     * Restores the persisted snapshot (or migrates legacy storage), registers the delivery listener
     * and the notification channel. Runs on the calling thread, before {@link #start()}.
     */
    public void initialize() {
        if (!initialized.compareAndSet(false, true)) {
            return;
        }
        SnapshotStore.LoadResult loaded = store.load();
        NotificationSnapshot snapshot = loaded.snapshot();
        List<ScheduleIndex.Entry> entries = new ArrayList<>(snapshot.notifications().size());
        for (SnapshotEntry entry : snapshot.notifications()) {
            if (entry.identifier() != null && !entry.identifier().isBlank()) {
                entries.add(new ScheduleIndex.Entry(entry.identifier(), entry.platformId(), entry.groupKey()));
            }
        }
        index.restore(entries);
        returnPolicy.restore(snapshot.returnConfig(), snapshot.lastOpenUnixTime());
        if (loaded.needsRewrite()) {
            flusher.markDirty();
        }
        platform.setDeliveryListener(new DeliveryListener() {
            @Override
            public void onReceived(String identifier, String title, String body) {
                dispatcher.post(() -> events.publish(NotificationEvent.Type.RECEIVED, identifier, title, body));
            }

            @Override
            public void onTapped(String identifier, String title, String body) {
                dispatcher.post(() -> events.publish(NotificationEvent.Type.TAPPED, identifier, title, body));
            }
        });
        platform.registerChannel(channel);
        log.info("[NotificationService] Initialized on {} backend: {} tracked ({})", platform.kind(),
                index.count(), loaded.source());
    }

    /**
     * Starts the runner thread; it becomes the dispatch thread and ticks at the configured interval.
     */
    public synchronized void start() {
        if (runner != null || closed.get()) {
            return;
        }
        initialize();
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "notifications-runner");
            t.setDaemon(true);
            return t;
        });
        try {
            executor.submit(dispatcher::bindToCurrentThread).get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            return;
        } catch (ExecutionException ex) {
            executor.shutdownNow();
            throw new IllegalStateException("Unable to start the notification runner", ex.getCause());
        }
        long interval = settings.tickInterval().toMillis();
        executor.scheduleAtFixedRate(this::safeTick, interval, interval, TimeUnit.MILLISECONDS);
        runner = executor;
    }

    /**
     * Binds the dispatcher to the calling thread, for hosts that drive {@link #tick()} themselves.
     */
    public void bindDispatcherToCurrentThread() {
        dispatcher.bindToCurrentThread();
    }

    /**
     * One engine step: breaker cool-down check, periodic metrics fold, dispatcher drain. Must run on
     * the dispatch thread.
     *
     * @return number of dispatched actions executed
     */
    public int tick() {
        if (breaker.checkCooldown()) {
            flusher.resumeIfDirty();
        }
        Instant now = clock.instant();
        if (Duration.between(lastMetricsFlush, now).compareTo(settings.metricsFlushInterval()) >= 0) {
            lastMetricsFlush = now;
            foldCounters();
        }
        return dispatcher.drain();
    }

    private void safeTick() {
        try {
            tick();
        } catch (Throwable t) {
            log.error("Unhandled exception during notification tick", t);
        }
    }

    /**
     * Final bounded flush, then stops the runner and the backend. Safe to call more than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        boolean flushed = flusher.flushOnShutdown(settings.shutdownFlushBudget());
        if (!flushed) {
            log.warn("[NotificationService] State may not have been persisted before shutdown");
        }
        ScheduledExecutorService executor = runner;
        if (executor != null) {
            executor.shutdownNow();
        }
        dispatcher.close();
        flusher.close();
        try {
            platform.shutdown();
        } catch (RuntimeException ex) {
            log.warn("[NotificationService] Backend shutdown failed", ex);
        }
        log.info("[NotificationService] Closed");
    }

    // ------------------------------------------------------------------ scheduling

    /**
     * The descriptor is copied, so the caller may reuse it once this returns. A missing identifier is
     * generated and written back to {@code descriptor}.
     */
    public boolean schedule(NotificationDescriptor descriptor) {
        return onDispatch("schedule", scheduleTask(copyOf(descriptor)), null) != null;
    }

    public boolean schedule(String title, String body, int fireDelaySeconds, String identifier) {
        return create().title(title).body(body).delaySeconds(fireDelaySeconds).identifier(identifier).schedule();
    }

    public boolean scheduleRepeating(String title, String body, int fireDelaySeconds, RepeatInterval interval,
                                     String identifier) {
        return create().title(title).body(body).delaySeconds(fireDelaySeconds).identifier(identifier)
                .repeat(interval).schedule();
    }

    public boolean scheduleAt(String title, String body, Instant fireAt, String identifier) {
        return create().title(title).body(body).at(fireAt).identifier(identifier).schedule();
    }

    public NotificationBuilder create() {
        return new NotificationBuilder(this, descriptorPool.acquire());
    }

    /**
     * Schedules up to the configured batch size; the rest is skipped.
     *
     * @return number of notifications scheduled
     */
    public int scheduleBatch(List<NotificationDescriptor> descriptors) {
        return onDispatch("scheduleBatch", batchTask(descriptors), 0);
    }

    /**
     * Asynchronous {@link #schedule(NotificationDescriptor)}; needs a started runner or a bound
     * dispatch thread.
     *
     * @return future of the platform id
     */
    public CompletableFuture<Integer> scheduleAsync(NotificationDescriptor descriptor, CancellationSignal signal) {
        return dispatcher.submit("schedule", scheduleTask(copyOf(descriptor)), signal, settings.asyncTimeout());
    }

    public CompletableFuture<Integer> scheduleBatchAsync(List<NotificationDescriptor> descriptors,
                                                         CancellationSignal signal) {
        return dispatcher.submit("scheduleBatch", batchTask(descriptors), signal, settings.asyncTimeout());
    }

    boolean scheduleOwned(NotificationDescriptor pooled) {
        ensureIdentifier(pooled);
        return onDispatch("schedule", scheduleTask(pooled), null) != null;
    }

    CompletableFuture<Integer> scheduleOwnedAsync(NotificationDescriptor pooled, CancellationSignal signal) {
        ensureIdentifier(pooled);
        return dispatcher.submit("schedule", scheduleTask(pooled), signal, settings.asyncTimeout());
    }

    void recycle(NotificationDescriptor pooled) {
        descriptorPool.release(pooled);
    }

    private NotificationDescriptor copyOf(NotificationDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        ensureIdentifier(descriptor);
        NotificationDescriptor pooled = descriptorPool.acquire();
        pooled.copyFrom(descriptor);
        return pooled;
    }

    /**
     * The task hands {@code pooled} back to the pool when it ends. A task the dispatcher skips never
     * does; the pool then allocates a fresh descriptor later.
     */
    private Callable<Integer> scheduleTask(NotificationDescriptor pooled) {
        return () -> {
            try {
                return doSchedule(pooled);
            } finally {
                descriptorPool.release(pooled);
            }
        };
    }

    private Callable<Integer> batchTask(List<NotificationDescriptor> descriptors) {
        if (descriptors == null || descriptors.isEmpty()) {
            return () -> 0;
        }
        int limit = settings.maxBatchSize();
        if (descriptors.size() > limit) {
            log.warn("[NotificationService] Batch of {} exceeds {}, the rest is skipped", descriptors.size(), limit);
        }
        List<NotificationDescriptor> copies = new ArrayList<>(Math.min(limit, descriptors.size()));
        for (NotificationDescriptor descriptor : descriptors.subList(0, Math.min(limit, descriptors.size()))) {
            if (descriptor != null) {
                copies.add(copyOf(descriptor));
            }
        }
        return () -> {
            int scheduled = 0;
            for (NotificationDescriptor pooled : copies) {
                try {
                    doSchedule(pooled);
                    scheduled++;
                } catch (NotificationException ex) {
                    log.debug("[NotificationService] Batch entry {} failed: {}", pooled.getIdentifier(),
                            ex.getMessage());
                } finally {
                    descriptorPool.release(pooled);
                }
            }
            return scheduled;
        };
    }

    private int doSchedule(NotificationDescriptor descriptor) {
        String identifier = descriptor.getIdentifier();
        try {
            List<String> problems = descriptor.validationErrors();
            if (!problems.isEmpty()) {
                throw new ValidationException(problems);
            }
            if (breaker.isOpen()) {
                throw new CircuitOpenException("schedule of " + identifier);
            }
            OptionalInt previous = index.platformIdOf(identifier);
            if (previous.isEmpty() && index.count() >= platform.maxPending()) {
                throw new CapacityExceededException(platform.maxPending());
            }
            int platformId;
            try {
                if (previous.isPresent()) {
                    platform.cancel(identifier, previous.getAsInt());
                }
                platformId = platform.schedule(descriptor);
            } catch (CapacityExceededException ex) {
                if (previous.isPresent()) {
                    index.remove(identifier);
                    flusher.markDirty();
                }
                throw ex;
            } catch (RuntimeException ex) {
                breaker.recordError();
                if (previous.isPresent()) {
                    index.remove(identifier);
                    flusher.markDirty();
                }
                throw ex instanceof PlatformException pe ? pe
                        : new PlatformException("Backend failed to schedule " + identifier, ex);
            }
            breaker.recordSuccess();
            index.insert(identifier, platformId, descriptor.getGroupKey()).ifPresent(evicted ->
                    log.warn("[NotificationService] Tracking limit {} reached, forgot oldest {}; it stays pending"
                            + " on {} until it fires", index.maxTracked(), evicted, platform.kind()));
            metrics.recordScheduled();
            flusher.markDirty();
            log.debug("[NotificationService] Scheduled {} -> {}", identifier, platformId);
            return platformId;
        } catch (NotificationException ex) {
            reportFailure("schedule", ex);
            throw ex;
        }
    }

    // ------------------------------------------------------------------ cancellation

    public boolean cancel(String identifier) {
        return onDispatch("cancel", () -> doCancel(identifier), false);
    }

    public CompletableFuture<Boolean> cancelAsync(String identifier, CancellationSignal signal) {
        return dispatcher.submit("cancel", () -> doCancel(identifier), signal, settings.asyncTimeout());
    }

    /**
     * Cancels up to the configured batch size under a single index write.
     *
     * @return number of notifications cancelled
     */
    public int cancelBatch(List<String> identifiers) {
        if (identifiers == null || identifiers.isEmpty()) {
            return 0;
        }
        List<String> bounded = identifiers;
        if (identifiers.size() > settings.maxBatchSize()) {
            log.warn("[NotificationService] Cancel batch of {} exceeds {}, the rest is skipped",
                    identifiers.size(), settings.maxBatchSize());
            bounded = identifiers.subList(0, settings.maxBatchSize());
        }
        List<String> targets = List.copyOf(bounded);
        return onDispatch("cancelBatch", () -> {
            List<ScheduleIndex.Entry> removed = index.removeAll(targets);
            for (ScheduleIndex.Entry entry : removed) {
                cancelOnPlatform(entry.identifier(), entry.platformId());
            }
            if (!removed.isEmpty()) {
                metrics.recordCancelled(removed.size());
                flusher.markDirty();
            }
            return removed.size();
        }, 0);
    }

    /**
     * @return number of group members cancelled
     */
    public int cancelGroup(String groupKey) {
        if (groupKey == null) {
            return 0;
        }
        return onDispatch("cancelGroup", () -> groups.cancelGroup(groupKey, this::doCancel), 0);
    }

    public void cancelAllScheduled() {
        onDispatch("cancelAllScheduled", () -> {
            try {
                platform.cancelAllScheduled();
                breaker.recordSuccess();
            } catch (RuntimeException ex) {
                breaker.recordError();
                reportFailure("cancelAllScheduled", wrap("cancel everything", ex));
            }
            List<ScheduleIndex.Entry> cleared = index.clear();
            metrics.recordCancelled(cleared.size());
            flusher.markDirty();
            return cleared.size();
        }, 0);
    }

    public void cancelAllDisplayed() {
        onDispatch("cancelAllDisplayed", () -> {
            try {
                platform.cancelAllDisplayed();
            } catch (RuntimeException ex) {
                reportFailure("cancelAllDisplayed", wrap("clear displayed notifications", ex));
            }
            return null;
        }, null);
    }

    public void cancelAll() {
        cancelAllScheduled();
        cancelAllDisplayed();
    }

    private boolean doCancel(String identifier) {
        OptionalInt platformId = index.remove(identifier);
        if (platformId.isEmpty()) {
            return false;
        }
        cancelOnPlatform(identifier, platformId.getAsInt());
        metrics.recordCancelled(1);
        flusher.markDirty();
        return true;
    }

    private void cancelOnPlatform(String identifier, int platformId) {
        try {
            platform.cancel(identifier, platformId);
            breaker.recordSuccess();
        } catch (RuntimeException ex) {
            breaker.recordError();
            reportFailure("cancel", wrap("cancel " + identifier, ex));
        }
    }

    /**
     * Forgets tracked notifications the backend no longer knows about.
     *
     * @return number of entries removed
     */
    public int cleanupExpired() {
        return onDispatch("cleanupExpired", () -> {
            List<String> stale = new ArrayList<>();
            for (ScheduleIndex.Entry entry : index.entries()) {
                NotificationStatus status;
                try {
                    status = platform.queryStatus(entry.identifier(), entry.platformId());
                } catch (RuntimeException ex) {
                    log.warn("[NotificationService] Status check failed for {}", entry.identifier(), ex);
                    continue;
                }
                if (status == NotificationStatus.NOT_FOUND || status == NotificationStatus.UNKNOWN
                        || status == NotificationStatus.EXPIRED) {
                    stale.add(entry.identifier());
                }
            }
            List<ScheduleIndex.Entry> removed = index.removeAll(stale);
            if (!removed.isEmpty()) {
                log.info("[NotificationService] Cleaned up {} expired notifications", removed.size());
                flusher.markDirty();
            }
            return removed.size();
        }, 0);
    }

    // ------------------------------------------------------------------ queries

    public int count() {
        return index.count();
    }

    public CompletableFuture<Integer> countAsync(CancellationSignal signal) {
        return dispatcher.submit("count", index::count, signal, settings.asyncTimeout());
    }

    public int countByGroup(String groupKey) {
        return groups.countOf(groupKey);
    }

    public List<String> membersOf(String groupKey) {
        return groups.membersOf(groupKey);
    }

    /**
     * @return tracked identifiers, oldest first
     */
    public List<String> allIdentifiers() {
        return index.identifiers();
    }

    public boolean isScheduled(String identifier) {
        return index.contains(identifier);
    }

    public NotificationStatus statusOf(String identifier) {
        OptionalInt platformId = index.platformIdOf(identifier);
        if (platformId.isEmpty()) {
            return NotificationStatus.NOT_FOUND;
        }
        return onDispatch("statusOf", () -> platform.queryStatus(identifier, platformId.getAsInt()),
                NotificationStatus.ERROR);
    }

    // ------------------------------------------------------------------ configuration

    public ReturnNotificationConfig returnNotificationConfig() {
        return returnPolicy.config();
    }

    public void configureReturnNotification(ReturnNotificationConfig config) {
        onDispatch("configureReturnNotification", () -> {
            returnPolicy.configure(config);
            return null;
        }, null);
    }

    public void setReturnNotificationEnabled(boolean enabled) {
        onDispatch("setReturnNotificationEnabled", () -> {
            returnPolicy.setEnabled(enabled);
            return null;
        }, null);
    }

    public void configureChannel(ChannelConfig config) {
        ChannelConfig normalized = (config == null ? ChannelConfig.defaults() : config).normalized();
        channel = normalized;
        if (initialized.get()) {
            onDispatch("configureChannel", () -> {
                platform.registerChannel(normalized);
                return null;
            }, null);
        }
    }

    public void setBadgeCount(int count) {
        onDispatch("setBadgeCount", () -> {
            platform.setBadgeCount(Math.max(0, count));
            return null;
        }, null);
    }

    // ------------------------------------------------------------------ permission

    public boolean hasPermission() {
        return onDispatch("hasPermission", platform::hasPermission, false);
    }

    /**
     * Asks the user for permission if it has not been decided. Publishes a permission event with the
     * outcome and fails with a timeout if the user does not answer in time.
     */
    public CompletableFuture<Boolean> requestPermissionAsync(CancellationSignal signal) {
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        CompletableFuture<Void> started = dispatcher.submit("requestPermission", () -> {
            platform.requestPermission(granted -> dispatcher.execute(() -> {
                events.publish(granted ? NotificationEvent.Type.PERMISSION_GRANTED
                        : NotificationEvent.Type.PERMISSION_DENIED, null, null, null);
                result.complete(granted);
            }));
            return null;
        }, signal, settings.permissionTimeout());
        started.whenComplete((ignored, error) -> {
            if (error != null) {
                result.completeExceptionally(error);
            }
        });
        return dispatcher.guard("requestPermission", result, signal, settings.permissionTimeout());
    }

    // ------------------------------------------------------------------ application lifecycle

    public void onBackgrounded() {
        onDispatch("onBackgrounded", () -> {
            returnPolicy.onBackgrounded();
            return null;
        }, null);
    }

    public void onForegrounded() {
        onDispatch("onForegrounded", () -> {
            returnPolicy.onForegrounded();
            return null;
        }, null);
    }

    // ------------------------------------------------------------------ diagnostics

    public NotificationEvents events() {
        return events;
    }

    public PerformanceMetrics metrics() {
        foldCounters();
        return metrics.snapshot();
    }

    public void resetMetrics() {
        foldCounters();
        metrics.reset();
    }

    /**
     * Writes the current state regardless of the debounce window.
     *
     * @return future completing with true once written
     */
    public CompletableFuture<Boolean> flushAsync() {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return flusher.forceFlush().get();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return false;
            } catch (ExecutionException ex) {
                throw new PersistenceException("Forced flush failed", ex.getCause());
            }
        });
    }

    public String debugInfo() {
        PerformanceMetrics m = metrics();
        return "backend=" + platform.kind()
                + " tracked=" + index.count() + "/" + index.maxTracked()
                + " maxPending=" + platform.maxPending()
                + " groups=" + groups.groupCount()
                + " breaker=" + breaker.state()
                + " queued=" + dispatcher.pendingCount()
                + " dirty=" + flusher.isDirty()
                + " scheduled=" + m.totalScheduled()
                + " cancelled=" + m.totalCancelled()
                + " errors=" + m.totalErrors()
                + " poolHitRate=" + String.format("%.1f%%", m.poolHitRate())
                + " drops=" + m.dispatcherDrops()
                + " avgSaveMs=" + String.format("%.2f", m.averageSaveTimeMs());
    }

    CircuitBreaker breaker() {
        return breaker;
    }

    MainThreadDispatcher dispatcher() {
        return dispatcher;
    }

    DebouncedFlusher flusher() {
        return flusher;
    }

    Clock clock() {
        return clock;
    }

    // ------------------------------------------------------------------ internals

    private NotificationSnapshot captureSnapshot() {
        List<ScheduleIndex.Entry> entries = index.entries();
        List<SnapshotEntry> persisted = new ArrayList<>(entries.size());
        for (ScheduleIndex.Entry entry : entries) {
            persisted.add(new SnapshotEntry(entry.identifier(), entry.platformId(), entry.groupKey()));
        }
        return NotificationSnapshot.of(persisted, returnPolicy.config(), returnPolicy.lastForegroundUnixSeconds());
    }

    private void foldCounters() {
        metrics.recordPool(descriptorPool.drainHits() + eventPool.drainHits(),
                descriptorPool.drainMisses() + eventPool.drainMisses());
        metrics.recordDispatcherDrops(dispatcher.drainDropped());
    }

    private void ensureIdentifier(NotificationDescriptor descriptor) {
        String identifier = descriptor.getIdentifier();
        if (identifier == null || identifier.isBlank()) {
            descriptor.setIdentifier(UUID.randomUUID().toString());
        }
    }

    private void reportFailure(String operation, NotificationException error) {
        metrics.recordError();
        log.warn("[NotificationService] {} failed: {}", operation, error.getMessage());
        dispatcher.execute(() -> events.publishError(operation, error));
    }

    private static PlatformException wrap(String action, RuntimeException ex) {
        return ex instanceof PlatformException pe ? pe : new PlatformException("Backend failed to " + action, ex);
    }

    /**
     * Runs {@code work} on the dispatch thread and waits for it, inline when already there or when
     * no dispatch thread exists yet.
     */
    private <T> T onDispatch(String operation, Callable<T> work, T fallback) {
        if (!dispatcher.isBound()) {
            synchronized (this) {
                return callQuietly(operation, work, fallback);
            }
        }
        return await(operation, dispatcher.submit(operation, work, null, settings.asyncTimeout())).orElse(fallback);
    }

    private static <T> T callQuietly(String operation, Callable<T> work, T fallback) {
        try {
            return work.call();
        } catch (NotificationException ex) {
            log.debug("[NotificationService] {} failed: {}", operation, ex.getMessage());
            return fallback;
        } catch (Exception ex) {
            log.error("[NotificationService] {} failed", operation, ex);
            return fallback;
        }
    }

    private static <T> Optional<T> await(String operation, CompletableFuture<T> future) {
        try {
            return Optional.ofNullable(future.get());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (CancellationException ex) {
            log.debug("[NotificationService] {} cancelled", operation);
            return Optional.empty();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof NotificationException) {
                log.debug("[NotificationService] {} failed: {}", operation, cause.getMessage());
            } else {
                log.error("[NotificationService] {} failed", operation, cause);
            }
            return Optional.empty();
        }
    }

    private final class EngineCommands implements NotificationCommands {

        @Override
        public boolean schedule(NotificationDescriptor descriptor) {
            try {
                ensureIdentifier(descriptor);
                doSchedule(descriptor);
                return true;
            } catch (NotificationException ex) {
                return false;
            }
        }

        @Override
        public boolean cancel(String identifier) {
            return doCancel(identifier);
        }

        @Override
        public void clearDisplayed() {
            try {
                platform.cancelAllDisplayed();
            } catch (RuntimeException ex) {
                reportFailure("cancelAllDisplayed", wrap("clear displayed notifications", ex));
            }
        }

        @Override
        public boolean refreshPermission() {
            boolean before = platform.hasPermission();
            boolean after = platform.refreshPermission();
            if (before != after) {
                events.publish(after ? NotificationEvent.Type.PERMISSION_GRANTED
                        : NotificationEvent.Type.PERMISSION_DENIED, null, null, null);
            }
            return after;
        }

        @Override
        public void requestFlush() {
            flusher.markDirty();
        }
    }
}
