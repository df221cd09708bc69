package com.taskboard.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import com.taskboard.backend.global.security.JwtAuthenticationPrincipal;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;

class TaskboardAuditorAwareTest {

    private final TaskboardAuditorAware auditorAware = new TaskboardAuditorAware();

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void resolvesUserIdFromJwtPrincipal() {
        JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(7L, "alice", List.of("USER"));
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(principal, "token", List.of()));

        assertThat(auditorAware.getCurrentAuditor()).contains(7L);
    }

    @Test
    void emptyWithoutAuthentication() {
        assertThat(auditorAware.getCurrentAuditor()).isEmpty();
    }

    @Test
    void emptyForNonJwtPrincipal() {
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken("system", "n/a", List.of()));

        assertThat(auditorAware.getCurrentAuditor()).isEmpty();
    }
}
