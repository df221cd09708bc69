package com.taskboard.backend.modules.assignee.infrastructure.persistence;

public interface TaskAssigneeRepositoryCustom {

    AssigneeSearchResult searchAssignees(AssigneeSearchCondition condition);
}
