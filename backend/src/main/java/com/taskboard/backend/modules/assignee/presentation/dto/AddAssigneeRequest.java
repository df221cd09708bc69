package com.taskboard.backend.modules.assignee.presentation.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record AddAssigneeRequest(
        @NotNull @Positive Long userId
) {
}
