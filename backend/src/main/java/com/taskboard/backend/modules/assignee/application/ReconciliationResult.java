package com.taskboard.backend.modules.assignee.application;

import java.util.List;
import java.util.SortedSet;

import com.taskboard.backend.modules.assignee.domain.ReconciliationStage;
import com.taskboard.backend.modules.assignee.infrastructure.persistence.AssigneeUserView;

/**
 * Outcome of a bulk replacement.
 *
 * @param added       user ids inserted, ascending
 * @param removed     user ids deleted, ascending
 * @param assignees   assignee set after the replacement
 * @param listTouched whether the owning list's last-modified marker advanced
 * @param stage       last stage reached
 */
public record ReconciliationResult(
        Long taskId,
        Long listId,
        List<Long> added,
        List<Long> removed,
        List<AssigneeUserView> assignees,
        boolean listTouched,
        ReconciliationStage stage
) {

    static ReconciliationResult applied(
            Long taskId,
            Long listId,
            SortedSet<Long> added,
            SortedSet<Long> removed,
            List<AssigneeUserView> assignees,
            boolean listTouched
    ) {
        return new ReconciliationResult(taskId, listId, List.copyOf(added), List.copyOf(removed),
                List.copyOf(assignees), listTouched, ReconciliationStage.APPLIED);
    }

    ReconciliationResult withStage(ReconciliationStage nextStage) {
        return new ReconciliationResult(taskId, listId, added, removed, assignees, listTouched, nextStage);
    }

    public boolean changed() {
        return !added.isEmpty() || !removed.isEmpty();
    }
}
