package com.taskboard.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;

import com.taskboard.backend.modules.auth.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    @Query("select u from AppUser u where lower(u.username) = lower(:username)")
    Optional<AppUser> findByUsernameIgnoreCase(@Param("username") String username);

    @Query("""
            select case when count(ur) > 0 then true else false end
              from UserRole ur
             where ur.appUser.id = :userId
               and ur.revokedAt is null
               and upper(ur.role.code) = 'ADMIN'
            """)
    boolean existsActiveAdminRole(@Param("userId") Long userId);
}
