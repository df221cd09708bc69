package com.taskboard.backend.modules.assignee.infrastructure.persistence;

import java.time.OffsetDateTime;

import com.taskboard.backend.modules.assignee.domain.TaskAssignee;
import com.taskboard.backend.modules.auth.domain.AppUser;

public record AssigneeUserView(
        Long userId,
        String username,
        String fullName,
        String email,
        OffsetDateTime assignedAt
) {

    public static AssigneeUserView from(TaskAssignee assignee) {
        AppUser user = assignee.getUser();
        return new AssigneeUserView(
                user.getId(),
                user.getUsername(),
                user.getFullName(),
                user.getEmail(),
                assignee.getCreatedAt()
        );
    }
}
