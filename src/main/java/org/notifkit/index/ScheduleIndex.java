package org.notifkit.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded map from notification identifier to platform id, ordered by insertion. When full, the
 * oldest entry is evicted in constant time through an intrusive doubly linked list.
 */
public final class ScheduleIndex {

    private static final Logger log = LoggerFactory.getLogger(ScheduleIndex.class);

    public record Entry(String identifier, int platformId, String groupKey) {
        public Entry {
            Objects.requireNonNull(identifier, "identifier");
        }
    }

    private static final class Node {
        final String identifier;
        final int platformId;
        final String groupKey;
        Node prev;
        Node next;

        Node(String identifier, int platformId, String groupKey) {
            this.identifier = identifier;
            this.platformId = platformId;
            this.groupKey = groupKey;
        }
    }

    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();
    private final Map<String, Node> nodes = new HashMap<>();
    private final GroupRegistry registry;
    private final int maxTracked;
    private Node head;
    private Node tail;

    public ScheduleIndex(int maxTracked, GroupRegistry registry) {
        if (maxTracked < 1) {
            throw new IllegalArgumentException("maxTracked must be >= 1: " + maxTracked);
        }
        this.maxTracked = maxTracked;
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public int maxTracked() {
        return maxTracked;
    }

    /**
     * Tracks {@code identifier}. An existing entry for the same identifier is replaced and moves to
     * the newest position; otherwise, if the index is full, the oldest entry is dropped first.
     *
     * @param groupKey group to register the identifier under, or {@code null}
     * @return the identifier that was evicted to make room, if any
     */
    public Optional<String> insert(String identifier, int platformId, String groupKey) {
        Objects.requireNonNull(identifier, "identifier");
        rw.writeLock().lock();
        try {
            String evicted = null;
            Node existing = nodes.remove(identifier);
            if (existing != null) {
                unlink(existing);
                registry.removeFromAllGroups(identifier);
            } else if (nodes.size() >= maxTracked && head != null) {
                Node oldest = head;
                unlink(oldest);
                nodes.remove(oldest.identifier);
                registry.removeFromAllGroups(oldest.identifier);
                evicted = oldest.identifier;
                log.debug("[ScheduleIndex] Evicted {} (limit {})", evicted, maxTracked);
            }
            Node node = new Node(identifier, platformId, groupKey);
            linkLast(node);
            nodes.put(identifier, node);
            if (groupKey != null && !groupKey.isBlank()) {
                registry.addToGroup(groupKey, identifier);
            }
            return Optional.ofNullable(evicted);
        } finally {
            rw.writeLock().unlock();
        }
    }

    public OptionalInt remove(String identifier) {
        if (identifier == null) {
            return OptionalInt.empty();
        }
        rw.writeLock().lock();
        try {
            Node node = nodes.remove(identifier);
            if (node == null) {
                return OptionalInt.empty();
            }
            unlink(node);
            registry.removeFromAllGroups(identifier);
            return OptionalInt.of(node.platformId);
        } finally {
            rw.writeLock().unlock();
        }
    }

    /**
     * Removes every listed identifier under a single write lock.
     *
     * @return the removed entries, in the order given
     */
    public List<Entry> removeAll(Collection<String> identifiers) {
        List<Entry> removed = new ArrayList<>();
        if (identifiers == null || identifiers.isEmpty()) {
            return removed;
        }
        rw.writeLock().lock();
        try {
            for (String identifier : identifiers) {
                Node node = identifier == null ? null : nodes.remove(identifier);
                if (node == null) {
                    continue;
                }
                unlink(node);
                registry.removeFromAllGroups(identifier);
                removed.add(new Entry(node.identifier, node.platformId, node.groupKey));
            }
            return removed;
        } finally {
            rw.writeLock().unlock();
        }
    }

    public int count() {
        rw.readLock().lock();
        try {
            return nodes.size();
        } finally {
            rw.readLock().unlock();
        }
    }

    public boolean contains(String identifier) {
        rw.readLock().lock();
        try {
            return identifier != null && nodes.containsKey(identifier);
        } finally {
            rw.readLock().unlock();
        }
    }

    public OptionalInt platformIdOf(String identifier) {
        rw.readLock().lock();
        try {
            Node node = identifier == null ? null : nodes.get(identifier);
            return node == null ? OptionalInt.empty() : OptionalInt.of(node.platformId);
        } finally {
            rw.readLock().unlock();
        }
    }

    /**
     * @return identifiers from oldest to newest
     */
    public List<String> identifiers() {
        rw.readLock().lock();
        try {
            List<String> out = new ArrayList<>(nodes.size());
            for (Node n = head; n != null; n = n.next) {
                out.add(n.identifier);
            }
            return out;
        } finally {
            rw.readLock().unlock();
        }
    }

    /**
     * Copy of all entries from oldest to newest. This is what the save path captures.
     */
    public List<Entry> entries() {
        rw.readLock().lock();
        try {
            List<Entry> out = new ArrayList<>(nodes.size());
            for (Node n = head; n != null; n = n.next) {
                out.add(new Entry(n.identifier, n.platformId, n.groupKey));
            }
            return out;
        } finally {
            rw.readLock().unlock();
        }
    }

    /**
     * Drops everything and returns what was tracked.
     */
    public List<Entry> clear() {
        rw.writeLock().lock();
        try {
            List<Entry> out = new ArrayList<>(nodes.size());
            for (Node n = head; n != null; n = n.next) {
                out.add(new Entry(n.identifier, n.platformId, n.groupKey));
            }
            nodes.clear();
            head = null;
            tail = null;
            registry.clear();
            return out;
        } finally {
            rw.writeLock().unlock();
        }
    }

    /**
     * Replaces the content with persisted entries, oldest first. Entries beyond the limit push out
     * the oldest ones as they would at runtime.
     */
    public void restore(List<Entry> entries) {
        rw.writeLock().lock();
        try {
            nodes.clear();
            head = null;
            tail = null;
            registry.clear();
            if (entries == null) {
                return;
            }
            for (Entry entry : entries) {
                if (entry == null || entry.identifier().isBlank()) {
                    continue;
                }
                insert(entry.identifier(), entry.platformId(), entry.groupKey());
            }
        } finally {
            rw.writeLock().unlock();
        }
    }

    private void linkLast(Node node) {
        node.prev = tail;
        node.next = null;
        if (tail == null) {
            head = node;
        } else {
            tail.next = node;
        }
        tail = node;
    }

    private void unlink(Node node) {
        if (node.prev == null) {
            head = node.next;
        } else {
            node.prev.next = node.next;
        }
        if (node.next == null) {
            tail = node.prev;
        } else {
            node.next.prev = node.prev;
        }
        node.prev = null;
        node.next = null;
    }
}
