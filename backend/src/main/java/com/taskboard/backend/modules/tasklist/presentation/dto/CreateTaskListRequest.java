package com.taskboard.backend.modules.tasklist.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateTaskListRequest(
        @NotBlank(message = "title is required")
        @Size(max = 250, message = "title must be at most 250 characters")
        String title
) {
}
