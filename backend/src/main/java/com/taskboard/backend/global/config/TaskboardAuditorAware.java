package com.taskboard.backend.global.config;

import java.util.Optional;

import com.taskboard.backend.global.security.JwtAuthenticationPrincipal;

import org.springframework.data.domain.AuditorAware;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Resolves the current auditor (user id) for JPA auditing.
 * Falls back to {@code Optional.empty()} for anonymous and non-JWT authentications.
 */
public class TaskboardAuditorAware implements AuditorAware<Long> {

    @Override
    @NonNull
    public Optional<Long> getCurrentAuditor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }
        if (authentication.getPrincipal() instanceof JwtAuthenticationPrincipal jwtPrincipal) {
            return Optional.ofNullable(jwtPrincipal.userId());
        }
        return Optional.empty();
    }
}
