package com.taskboard.backend.modules.assignee.presentation.dto;

import java.time.OffsetDateTime;

import com.taskboard.backend.modules.assignee.infrastructure.persistence.AssigneeUserView;

public record AssigneeResponse(
        Long userId,
        String username,
        String fullName,
        String email,
        OffsetDateTime assignedAt
) {

    public static AssigneeResponse from(AssigneeUserView view) {
        return new AssigneeResponse(
                view.userId(),
                view.username(),
                view.fullName(),
                view.email(),
                view.assignedAt()
        );
    }
}
