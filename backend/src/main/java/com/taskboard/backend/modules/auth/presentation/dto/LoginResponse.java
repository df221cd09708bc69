package com.taskboard.backend.modules.auth.presentation.dto;

public record LoginResponse(AccessTokenResponse token, UserProfileResponse user) {
}
