package com.taskboard.backend.modules.assignee.presentation.dto;

public record MessageResponse(String message) {
}
