package com.taskboard.backend.modules.auth.application;

import java.util.List;

import com.taskboard.backend.modules.auth.domain.AppUser;
import com.taskboard.backend.modules.auth.domain.UserRole;
import com.taskboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.taskboard.backend.modules.auth.infrastructure.persistence.UserRoleRepository;
import com.taskboard.backend.modules.auth.presentation.dto.AccessTokenResponse;
import com.taskboard.backend.modules.auth.presentation.dto.LoginRequest;
import com.taskboard.backend.modules.auth.presentation.dto.LoginResponse;
import com.taskboard.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(readOnly = true)
public class AuthService {

    private final AppUserRepository appUserRepository;
    private final UserRoleRepository userRoleRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    public AuthService(
            AppUserRepository appUserRepository,
            UserRoleRepository userRoleRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService
    ) {
        this.appUserRepository = appUserRepository;
        this.userRoleRepository = userRoleRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
    }

    public LoginResponse login(LoginRequest request) {
        AppUser user = appUserRepository.findByUsernameIgnoreCase(request.username())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS"));

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS");
        }

        // checked after the password so a disabled account is not revealed to guessers
        if (!user.isActive()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "USER_INACTIVE");
        }

        List<String> roleCodes = extractActiveRoleCodes(user.getId());
        AccessTokenResponse token = jwtTokenService.issueAccessToken(user.getId(), user.getUsername(), roleCodes);
        return new LoginResponse(token, buildUserProfile(user, roleCodes));
    }

    public UserProfileResponse loadProfile(Long userId) {
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));
        return buildUserProfile(user, extractActiveRoleCodes(user.getId()));
    }

    private List<String> extractActiveRoleCodes(Long userId) {
        return userRoleRepository.findActiveRoles(userId).stream()
                .map(UserRole::getRole)
                .map(role -> role.getCode())
                .distinct()
                .toList();
    }

    private UserProfileResponse buildUserProfile(AppUser user, List<String> roleCodes) {
        return new UserProfileResponse(
                user.getId(),
                user.getUsername(),
                user.getFullName(),
                user.getEmail(),
                roleCodes,
                roleCodes.contains("ADMIN"),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
