package com.taskboard.backend.modules.tasklist.application;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.FORBIDDEN;
import static org.springframework.http.HttpStatus.NOT_FOUND;

import java.util.List;

import com.taskboard.backend.global.error.ProblemException;
import com.taskboard.backend.modules.auth.domain.AppUser;
import com.taskboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.taskboard.backend.modules.tasklist.domain.ListShare;
import com.taskboard.backend.modules.tasklist.domain.TaskList;
import com.taskboard.backend.modules.tasklist.infrastructure.persistence.ListShareRepository;
import com.taskboard.backend.modules.tasklist.infrastructure.persistence.TaskListRepository;
import com.taskboard.backend.modules.tasklist.presentation.dto.CreateTaskListRequest;
import com.taskboard.backend.modules.tasklist.presentation.dto.ListShareResponse;
import com.taskboard.backend.modules.tasklist.presentation.dto.ShareListRequest;
import com.taskboard.backend.modules.tasklist.presentation.dto.TaskListResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class TaskListService {

    private final TaskListRepository taskListRepository;
    private final ListShareRepository listShareRepository;
    private final AppUserRepository appUserRepository;
    private final TaskListAccessPolicy accessPolicy;

    public TaskListService(
            TaskListRepository taskListRepository,
            ListShareRepository listShareRepository,
            AppUserRepository appUserRepository,
            TaskListAccessPolicy accessPolicy
    ) {
        this.taskListRepository = taskListRepository;
        this.listShareRepository = listShareRepository;
        this.appUserRepository = appUserRepository;
        this.accessPolicy = accessPolicy;
    }

    public TaskListResponse createList(Long ownerId, CreateTaskListRequest request) {
        AppUser owner = appUserRepository.findById(ownerId)
                .orElseThrow(() -> new ProblemException(NOT_FOUND, "USER_NOT_FOUND"));
        TaskList list = new TaskList();
        list.setTitle(request.title().trim());
        list.setOwner(owner);
        taskListRepository.saveAndFlush(list);
        return toResponse(list, List.of());
    }

    @Transactional(readOnly = true)
    public TaskListResponse getList(Long callerId, Long listId) {
        TaskList list = loadList(listId);
        if (!accessPolicy.canRead(listId, callerId)) {
            throw new ProblemException(FORBIDDEN, "FORBIDDEN", "No read access to list %d".formatted(listId));
        }
        return toResponse(list, listShareRepository.findByTaskListIdWithUser(listId));
    }

    public ListShareResponse shareList(Long callerId, Long listId, ShareListRequest request) {
        TaskList list = loadList(listId);
        if (!accessPolicy.canManage(listId, callerId)) {
            throw new ProblemException(FORBIDDEN, "FORBIDDEN", "Only the owner can share list %d".formatted(listId));
        }
        if (list.getOwner().getId().equals(request.userId())) {
            throw new ProblemException(BAD_REQUEST, "CANNOT_SHARE_WITH_OWNER");
        }
        AppUser user = appUserRepository.findById(request.userId())
                .orElseThrow(() -> new ProblemException(NOT_FOUND, "USER_NOT_FOUND",
                        "User %d does not exist".formatted(request.userId())));

        ListShare share = listShareRepository.findByTaskListIdAndUserId(listId, user.getId())
                .orElseGet(ListShare::new);
        share.setTaskList(list);
        share.setUser(user);
        share.setPermission(request.permission());
        listShareRepository.saveAndFlush(share);
        return ListShareResponse.from(share);
    }

    public void revokeShare(Long callerId, Long listId, Long userId) {
        loadList(listId);
        if (!accessPolicy.canManage(listId, callerId)) {
            throw new ProblemException(FORBIDDEN, "FORBIDDEN", "Only the owner can unshare list %d".formatted(listId));
        }
        listShareRepository.deleteByTaskListIdAndUserId(listId, userId);
    }

    private TaskList loadList(Long listId) {
        return taskListRepository.findById(listId)
                .orElseThrow(() -> new ProblemException(NOT_FOUND, "LIST_NOT_FOUND",
                        "List %d does not exist".formatted(listId)));
    }

    private TaskListResponse toResponse(TaskList list, List<ListShare> shares) {
        return new TaskListResponse(
                list.getId(),
                list.getTitle(),
                list.getOwner().getId(),
                shares.stream().map(ListShareResponse::from).toList(),
                list.getCreatedAt(),
                list.getUpdatedAt()
        );
    }
}
