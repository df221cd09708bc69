package com.taskboard.backend.modules.assignee.presentation.dto;

import java.util.List;

/**
 * @param resultCount rows on this page
 * @param totalCount  assignees matching the filter, counted by a separate query
 */
public record AssigneeListResponse(
        List<AssigneeResponse> items,
        int page,
        int perPage,
        int resultCount,
        long totalCount,
        int totalPages
) {
}
