package com.taskboard.backend.modules.tasklist.application;

import com.taskboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.taskboard.backend.modules.tasklist.domain.SharePermission;
import com.taskboard.backend.modules.tasklist.infrastructure.persistence.ListShareRepository;
import com.taskboard.backend.modules.tasklist.infrastructure.persistence.TaskListRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Answers read and write questions about a task list from the database on every call.
 * Read: owner, any share, or the ADMIN role. Write: owner, a WRITE share, or the ADMIN role.
 */
@Component
@Transactional(readOnly = true)
public class TaskListAccessPolicy {

    private final TaskListRepository taskListRepository;
    private final ListShareRepository listShareRepository;
    private final AppUserRepository appUserRepository;

    public TaskListAccessPolicy(
            TaskListRepository taskListRepository,
            ListShareRepository listShareRepository,
            AppUserRepository appUserRepository
    ) {
        this.taskListRepository = taskListRepository;
        this.listShareRepository = listShareRepository;
        this.appUserRepository = appUserRepository;
    }

    public boolean canRead(Long listId, Long userId) {
        if (taskListRepository.existsByIdAndOwnerId(listId, userId)) {
            return true;
        }
        if (listShareRepository.existsByTaskListIdAndUserId(listId, userId)) {
            return true;
        }
        return appUserRepository.existsActiveAdminRole(userId);
    }

    public boolean canWrite(Long listId, Long userId) {
        if (taskListRepository.existsByIdAndOwnerId(listId, userId)) {
            return true;
        }
        if (listShareRepository.existsByTaskListIdAndUserIdAndPermission(listId, userId, SharePermission.WRITE)) {
            return true;
        }
        return appUserRepository.existsActiveAdminRole(userId);
    }

    public boolean canManage(Long listId, Long userId) {
        return taskListRepository.existsByIdAndOwnerId(listId, userId)
                || appUserRepository.existsActiveAdminRole(userId);
    }
}
