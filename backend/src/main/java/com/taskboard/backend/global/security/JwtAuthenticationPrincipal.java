package com.taskboard.backend.global.security;

import java.util.List;

public record JwtAuthenticationPrincipal(Long userId, String username, List<String> roles) {

    public boolean isAdmin() {
        return roles != null && roles.contains("ADMIN");
    }
}
