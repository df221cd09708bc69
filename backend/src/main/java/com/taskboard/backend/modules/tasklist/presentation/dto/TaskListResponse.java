package com.taskboard.backend.modules.tasklist.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

public record TaskListResponse(
        Long listId,
        String title,
        Long ownerId,
        List<ListShareResponse> shares,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
