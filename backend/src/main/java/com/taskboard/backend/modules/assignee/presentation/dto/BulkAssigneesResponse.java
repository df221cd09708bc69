package com.taskboard.backend.modules.assignee.presentation.dto;

import java.util.List;

import com.taskboard.backend.modules.assignee.application.ReconciliationResult;

public record BulkAssigneesResponse(
        Long taskId,
        List<AssigneeResponse> assignees,
        List<Long> added,
        List<Long> removed,
        boolean changed
) {

    public static BulkAssigneesResponse from(ReconciliationResult result) {
        return new BulkAssigneesResponse(
                result.taskId(),
                result.assignees().stream().map(AssigneeResponse::from).toList(),
                result.added(),
                result.removed(),
                result.changed()
        );
    }
}
