package org.notifkit.pool;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Bounded LIFO pool. Hits and misses are counted without taking the pool lock and are
 * drained periodically by the metrics flush.
 */
public final class ObjectPool<T extends Poolable> {

    private final String name;
    private final int capacity;
    private final Supplier<T> factory;
    private final Deque<T> stack;
    private final Object lock = new Object();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ObjectPool(String name, int capacity, Supplier<T> factory) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0: " + capacity);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
        this.factory = Objects.requireNonNull(factory, "factory");
        this.stack = new ArrayDeque<>(capacity);
    }

    public T acquire() {
        T pooled;
        synchronized (lock) {
            pooled = stack.pollFirst();
        }
        if (pooled != null) {
            hits.incrementAndGet();
            return pooled;
        }
        misses.incrementAndGet();
        return factory.get();
    }

    /**
     * Resets {@code obj} and keeps it for reuse when the pool has room; otherwise it is dropped.
     *
     * @return {@code true} when the object was pushed back
     */
    public boolean release(T obj) {
        if (obj == null) {
            return false;
        }
        synchronized (lock) {
            if (stack.size() >= capacity) {
                return false;
            }
            obj.reset();
            stack.push(obj);
            return true;
        }
    }

    public int size() {
        synchronized (lock) {
            return stack.size();
        }
    }

    public int capacity() {
        return capacity;
    }

    public String name() {
        return name;
    }

    public long drainHits() {
        return hits.getAndSet(0);
    }

    public long drainMisses() {
        return misses.getAndSet(0);
    }

    @Override
    public String toString() {
        return name + " pool " + size() + "/" + capacity;
    }
}
