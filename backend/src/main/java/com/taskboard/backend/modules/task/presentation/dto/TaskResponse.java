package com.taskboard.backend.modules.task.presentation.dto;

import java.time.OffsetDateTime;

import com.taskboard.backend.modules.task.domain.Task;

public record TaskResponse(
        Long taskId,
        Long listId,
        String title,
        String description,
        boolean done,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static TaskResponse from(Task task, Long listId) {
        return new TaskResponse(
                task.getId(),
                listId,
                task.getTitle(),
                task.getDescription(),
                task.isDone(),
                task.getCreatedAt(),
                task.getUpdatedAt()
        );
    }
}
