package com.taskboard.backend.modules.assignee.presentation.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * Desired assignee set. Duplicate user ids collapse; an empty list unassigns everyone.
 */
public record BulkAssigneesRequest(
        @NotNull List<@Valid @NotNull AssigneeReference> assignees
) {

    public List<Long> userIds() {
        return assignees.stream().map(AssigneeReference::userId).toList();
    }
}
