package com.taskboard.backend.modules.assignee.infrastructure.persistence;

import java.util.List;

/**
 * One page of assignees plus the number of assignees matching the same filter.
 * The two values come from separate queries and may disagree under concurrent writes.
 */
public record AssigneeSearchResult(List<AssigneeUserView> rows, long totalCount) {
}
