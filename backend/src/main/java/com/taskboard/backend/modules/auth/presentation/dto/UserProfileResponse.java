package com.taskboard.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

public record UserProfileResponse(
        Long userId,
        String username,
        String fullName,
        String email,
        List<String> roles,
        boolean isAdmin,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
