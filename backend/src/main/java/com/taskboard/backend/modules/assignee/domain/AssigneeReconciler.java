package com.taskboard.backend.modules.assignee.domain;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Set difference between the assignees a task has and the assignees a caller wants.
 * Membership is keyed by user id only; users present on both sides are left alone.
 */
public final class AssigneeReconciler {

    private AssigneeReconciler() {
    }

    public static AssigneeDelta reconcile(Set<Long> current, Set<Long> desired) {
        Objects.requireNonNull(current, "current must not be null");
        Objects.requireNonNull(desired, "desired must not be null");

        if (desired.isEmpty()) {
            return current.isEmpty() ? AssigneeDelta.none() : AssigneeDelta.removeEverything(current);
        }

        TreeSet<Long> toAdd = new TreeSet<>(desired);
        toAdd.removeAll(current);

        TreeSet<Long> toRemove = new TreeSet<>(current);
        toRemove.removeAll(desired);

        return new AssigneeDelta(toAdd, toRemove, false);
    }
}
