package org.notifkit.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Group key to member identifiers, with a reverse map so that removing an identifier touches only
 * the groups that hold it. Groups left empty are pruned.
 * <p>
 * Callers already holding the {@link ScheduleIndex} lock may call in here; the opposite order is
 * never taken.
 */
public final class GroupRegistry {

    private static final Logger log = LoggerFactory.getLogger(GroupRegistry.class);

    private final Object lock = new Object();
    private final Map<String, Set<String>> membersByGroup = new HashMap<>();
    private final Map<String, Set<String>> groupsByMember = new HashMap<>();

    public void addToGroup(String groupKey, String identifier) {
        Objects.requireNonNull(groupKey, "groupKey");
        Objects.requireNonNull(identifier, "identifier");
        synchronized (lock) {
            membersByGroup.computeIfAbsent(groupKey, k -> new LinkedHashSet<>()).add(identifier);
            groupsByMember.computeIfAbsent(identifier, k -> new LinkedHashSet<>()).add(groupKey);
        }
    }

    public void removeFromAllGroups(String identifier) {
        if (identifier == null) {
            return;
        }
        synchronized (lock) {
            Set<String> groups = groupsByMember.remove(identifier);
            if (groups == null) {
                return;
            }
            for (String group : groups) {
                Set<String> members = membersByGroup.get(group);
                if (members == null) {
                    continue;
                }
                members.remove(identifier);
                if (members.isEmpty()) {
                    membersByGroup.remove(group);
                }
            }
        }
    }

    /**
     * @return a copy of the group's members in insertion order, empty for unknown groups
     */
    public List<String> membersOf(String groupKey) {
        synchronized (lock) {
            Set<String> members = membersByGroup.get(groupKey);
            return members == null ? List.of() : List.copyOf(members);
        }
    }

    public int countOf(String groupKey) {
        synchronized (lock) {
            Set<String> members = membersByGroup.get(groupKey);
            return members == null ? 0 : members.size();
        }
    }

    public int groupCount() {
        synchronized (lock) {
            return membersByGroup.size();
        }
    }

    public Set<String> groupsOf(String identifier) {
        synchronized (lock) {
            Set<String> groups = groupsByMember.get(identifier);
            return groups == null ? Set.of() : Set.copyOf(groups);
        }
    }

    public void clear() {
        synchronized (lock) {
            membersByGroup.clear();
            groupsByMember.clear();
        }
    }

    /**
     * Takes a snapshot of the group's members, releases the registry lock and hands every member to
     * {@code canceller}. A failing member is logged and does not stop the others.
     *
     * @return number of members handed to the canceller
     */
    public int cancelGroup(String groupKey, Consumer<String> canceller) {
        Objects.requireNonNull(canceller, "canceller");
        List<String> snapshot;
        synchronized (lock) {
            Set<String> members = membersByGroup.get(groupKey);
            snapshot = members == null ? List.of() : new ArrayList<>(members);
        }
        int handled = 0;
        for (String identifier : snapshot) {
            try {
                canceller.accept(identifier);
                handled++;
            } catch (RuntimeException ex) {
                log.warn("[GroupRegistry] Unable to cancel {} from group {}", identifier, groupKey, ex);
            }
        }
        return handled;
    }
}
