package com.taskboard.backend.modules.auth.domain;

public enum AppUserStatus {
    ACTIVE,
    DISABLED
}
