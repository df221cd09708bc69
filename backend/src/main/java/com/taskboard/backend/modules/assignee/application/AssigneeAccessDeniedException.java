package com.taskboard.backend.modules.assignee.application;

import com.taskboard.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class AssigneeAccessDeniedException extends ProblemException {

    public static final String CODE = "USER_DOES_NOT_HAVE_ACCESS_TO_LIST";

    private final Long listId;
    private final Long userId;

    public AssigneeAccessDeniedException(Long listId, Long userId) {
        super(HttpStatus.FORBIDDEN, CODE,
                "User %d does not have access to list %d".formatted(userId, listId));
        this.listId = listId;
        this.userId = userId;
    }

    public Long getListId() {
        return listId;
    }

    public Long getUserId() {
        return userId;
    }
}
