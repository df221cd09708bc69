package com.taskboard.backend.modules.tasklist.presentation.dto;

import com.taskboard.backend.modules.tasklist.domain.ListShare;
import com.taskboard.backend.modules.tasklist.domain.SharePermission;

public record ListShareResponse(Long userId, String username, SharePermission permission) {

    public static ListShareResponse from(ListShare share) {
        return new ListShareResponse(share.getUser().getId(), share.getUser().getUsername(), share.getPermission());
    }
}
