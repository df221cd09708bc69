package com.taskboard.backend.support;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.taskboard.backend.modules.auth.domain.AppUser;
import com.taskboard.backend.modules.auth.domain.AppUserStatus;
import com.taskboard.backend.modules.auth.domain.Role;
import com.taskboard.backend.modules.auth.domain.UserRole;
import com.taskboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.taskboard.backend.modules.auth.infrastructure.persistence.RoleRepository;
import com.taskboard.backend.modules.auth.infrastructure.persistence.UserRoleRepository;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class TestUserFactory {

    private final AppUserRepository appUserRepository;
    private final RoleRepository roleRepository;
    private final UserRoleRepository userRoleRepository;
    private final PasswordEncoder passwordEncoder;

    public TestUserFactory(
            AppUserRepository appUserRepository,
            RoleRepository roleRepository,
            UserRoleRepository userRoleRepository,
            PasswordEncoder passwordEncoder
    ) {
        this.appUserRepository = appUserRepository;
        this.roleRepository = roleRepository;
        this.userRoleRepository = userRoleRepository;
        this.passwordEncoder = passwordEncoder;
    }

    public AppUser ensureUser(String username, String rawPassword) {
        AppUser user = appUserRepository.findByUsernameIgnoreCase(username)
                .orElseGet(AppUser::new);
        user.setUsername(username);
        user.setPasswordHash(passwordEncoder.encode(rawPassword));
        user.setFullName("User " + username);
        user.setEmail(username + "@example.com");
        user.setStatus(AppUserStatus.ACTIVE);
        return appUserRepository.saveAndFlush(user);
    }

    public AppUser ensureAdmin(String username, String rawPassword) {
        AppUser admin = ensureUser(username, rawPassword);
        grantRole(admin, Role.ADMIN);
        return admin;
    }

    public void disable(AppUser user) {
        AppUser managed = appUserRepository.findById(user.getId()).orElseThrow();
        managed.setStatus(AppUserStatus.DISABLED);
        appUserRepository.saveAndFlush(managed);
    }

    public void grantRole(AppUser user, String roleCode) {
        boolean alreadyActive = userRoleRepository.findActiveRoles(user.getId()).stream()
                .anyMatch(role -> roleCode.equalsIgnoreCase(role.getRole().getCode()));
        if (alreadyActive) {
            return;
        }
        Role role = roleRepository.findById(roleCode)
                .orElseThrow(() -> new IllegalStateException("Role not found: " + roleCode));
        UserRole userRole = new UserRole();
        userRole.setAppUser(appUserRepository.getReferenceById(user.getId()));
        userRole.setRole(role);
        userRole.setGrantedAt(OffsetDateTime.now(ZoneOffset.UTC));
        userRoleRepository.save(userRole);
    }
}
