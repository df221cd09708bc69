package com.taskboard.backend.modules.tasklist.domain;

public enum SharePermission {
    READ,
    WRITE
}
