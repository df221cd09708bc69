package com.taskboard.backend.modules.assignee.application;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.CONFLICT;
import static org.springframework.http.HttpStatus.FORBIDDEN;
import static org.springframework.http.HttpStatus.NOT_FOUND;

import com.taskboard.backend.global.error.ProblemException;

final class AssigneeProblems {

    private AssigneeProblems() {
    }

    static ProblemException taskNotFound(Long taskId) {
        return new ProblemException(NOT_FOUND, "TASK_NOT_FOUND", "Task %d does not exist".formatted(taskId));
    }

    static ProblemException userNotFound(Long userId) {
        return new ProblemException(NOT_FOUND, "USER_NOT_FOUND", "User %d does not exist".formatted(userId));
    }

    static ProblemException invalidUserId(Long userId) {
        return new ProblemException(BAD_REQUEST, "INVALID_USER_ID", "User id must be positive but was " + userId);
    }

    static ProblemException alreadyAssigned(Long taskId, Long userId, Throwable cause) {
        return new ProblemException(CONFLICT, "ASSIGNEE_ALREADY_EXISTS",
                "User %d is already assigned to task %d".formatted(userId, taskId), cause);
    }

    static ProblemException noWriteAccess(Long taskId) {
        return new ProblemException(FORBIDDEN, "FORBIDDEN", "No write access to task %d".formatted(taskId));
    }

    static ProblemException noReadAccess(Long taskId) {
        return new ProblemException(FORBIDDEN, "FORBIDDEN", "No read access to task %d".formatted(taskId));
    }
}
