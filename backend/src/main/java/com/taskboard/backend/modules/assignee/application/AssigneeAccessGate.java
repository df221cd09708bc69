package com.taskboard.backend.modules.assignee.application;

import com.taskboard.backend.modules.auth.domain.AppUser;

/**
 * Decides whether a user may be assigned to tasks of a list.
 * This is about the assignee, not about the caller performing the change.
 */
public interface AssigneeAccessGate {

    boolean canAssign(AppUser user, Long listId);
}
