package com.taskboard.backend.modules.tasklist.presentation.dto;

import com.taskboard.backend.modules.tasklist.domain.SharePermission;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record ShareListRequest(
        @NotNull(message = "userId is required")
        @Positive(message = "userId must be positive")
        Long userId,
        @NotNull(message = "permission is required")
        SharePermission permission
) {
}
