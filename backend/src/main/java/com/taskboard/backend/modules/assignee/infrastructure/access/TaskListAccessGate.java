package com.taskboard.backend.modules.assignee.infrastructure.access;

import com.taskboard.backend.modules.assignee.application.AssigneeAccessGate;
import com.taskboard.backend.modules.auth.domain.AppUser;
import com.taskboard.backend.modules.tasklist.application.TaskListAccessPolicy;

import org.springframework.stereotype.Component;

/**
 * Active users who can read a list may be assigned to its tasks.
 */
@Component
public class TaskListAccessGate implements AssigneeAccessGate {

    private final TaskListAccessPolicy accessPolicy;

    public TaskListAccessGate(TaskListAccessPolicy accessPolicy) {
        this.accessPolicy = accessPolicy;
    }

    @Override
    public boolean canAssign(AppUser user, Long listId) {
        if (user == null || listId == null || !user.isActive()) {
            return false;
        }
        return accessPolicy.canRead(listId, user.getId());
    }
}
