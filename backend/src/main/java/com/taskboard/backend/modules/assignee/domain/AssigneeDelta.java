package com.taskboard.backend.modules.assignee.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Minimal change turning the current assignee set into the desired one.
 * Both sets iterate in ascending user id order.
 *
 * @param toAdd    user ids to insert
 * @param toRemove user ids to delete
 * @param clearAll true when every current assignee goes; removal is then applied per task, not per user
 */
public record AssigneeDelta(SortedSet<Long> toAdd, SortedSet<Long> toRemove, boolean clearAll) {

    private static final AssigneeDelta NONE = new AssigneeDelta(new TreeSet<>(), new TreeSet<>(), false);

    public AssigneeDelta {
        toAdd = Collections.unmodifiableSortedSet(new TreeSet<>(toAdd));
        toRemove = Collections.unmodifiableSortedSet(new TreeSet<>(toRemove));
    }

    public static AssigneeDelta none() {
        return NONE;
    }

    public static AssigneeDelta removeEverything(Collection<Long> current) {
        return new AssigneeDelta(new TreeSet<>(), new TreeSet<>(current), true);
    }

    public boolean isEmpty() {
        return toAdd.isEmpty() && toRemove.isEmpty();
    }
}
