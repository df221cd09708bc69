package com.taskboard.backend.modules.assignee.presentation.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record AssigneeReference(
        @NotNull @Positive Long userId
) {
}
