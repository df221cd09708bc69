package com.taskboard.backend.modules.assignee.infrastructure.persistence;

/**
 * @param taskId  task whose assignees are listed
 * @param keyword optional case-insensitive substring matched literally against usernames; used as given,
 *                without trimming. A null or blank keyword disables the filter.
 * @param limit   page size
 * @param offset  rows skipped before the page starts
 */
public record AssigneeSearchCondition(
        Long taskId,
        String keyword,
        int limit,
        long offset
) {
}
