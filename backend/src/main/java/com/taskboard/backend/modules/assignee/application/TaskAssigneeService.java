package com.taskboard.backend.modules.assignee.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

import com.taskboard.backend.global.config.AssigneeProperties;
import com.taskboard.backend.modules.assignee.domain.TaskAssignee;
import com.taskboard.backend.modules.assignee.infrastructure.persistence.AssigneeSearchResult;
import com.taskboard.backend.modules.assignee.presentation.dto.AddAssigneeRequest;
import com.taskboard.backend.modules.assignee.presentation.dto.AssigneeListResponse;
import com.taskboard.backend.modules.assignee.presentation.dto.AssigneeResponse;
import com.taskboard.backend.modules.assignee.presentation.dto.BulkAssigneesRequest;
import com.taskboard.backend.modules.assignee.presentation.dto.BulkAssigneesResponse;
import com.taskboard.backend.modules.auth.domain.AppUser;
import com.taskboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskRepository;
import com.taskboard.backend.modules.tasklist.application.TaskListAccessPolicy;
import com.taskboard.backend.modules.tasklist.infrastructure.persistence.TaskListRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TaskAssigneeService {

    private static final Logger log = LoggerFactory.getLogger(TaskAssigneeService.class);

    private final TaskRepository taskRepository;
    private final TaskListRepository taskListRepository;
    private final AppUserRepository appUserRepository;
    private final TaskListAccessPolicy accessPolicy;
    private final AssigneeAccessGate accessGate;
    private final TaskAssigneeStore assigneeStore;
    private final BulkAssigneeTransaction bulkAssigneeTransaction;
    private final AssigneeProperties properties;
    private final Clock clock;

    public TaskAssigneeService(
            TaskRepository taskRepository,
            TaskListRepository taskListRepository,
            AppUserRepository appUserRepository,
            TaskListAccessPolicy accessPolicy,
            AssigneeAccessGate accessGate,
            TaskAssigneeStore assigneeStore,
            BulkAssigneeTransaction bulkAssigneeTransaction,
            AssigneeProperties properties,
            Clock clock
    ) {
        this.taskRepository = taskRepository;
        this.taskListRepository = taskListRepository;
        this.appUserRepository = appUserRepository;
        this.accessPolicy = accessPolicy;
        this.accessGate = accessGate;
        this.assigneeStore = assigneeStore;
        this.bulkAssigneeTransaction = bulkAssigneeTransaction;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional
    public AssigneeResponse addAssignee(Long callerId, Long taskId, AddAssigneeRequest request) {
        Long userId = requireValidUserId(request.userId());
        Long listId = resolveWritableList(callerId, taskId);

        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> AssigneeProblems.userNotFound(userId));
        if (!accessGate.canAssign(user, listId)) {
            throw new AssigneeAccessDeniedException(listId, userId);
        }

        TaskAssignee assignee = assigneeStore.insert(taskId, userId);
        AssigneeResponse response = new AssigneeResponse(
                user.getId(),
                user.getUsername(),
                user.getFullName(),
                user.getEmail(),
                assignee.getCreatedAt()
        );
        taskListRepository.touchUpdatedAt(listId, OffsetDateTime.now(clock));
        log.info("Assigned user={} to task={}", userId, taskId);
        return response;
    }

    /**
     * Removing a user who is not assigned succeeds without writing anything.
     *
     * @return whether an assignment was deleted
     */
    @Transactional
    public boolean removeAssignee(Long callerId, Long taskId, Long userId) {
        requireValidUserId(userId);
        Long listId = resolveWritableList(callerId, taskId);

        int deleted = assigneeStore.deleteOne(taskId, userId);
        if (deleted == 0) {
            log.debug("User={} was not assigned to task={}", userId, taskId);
            return false;
        }
        taskListRepository.touchUpdatedAt(listId, OffsetDateTime.now(clock));
        log.info("Unassigned user={} from task={}", userId, taskId);
        return true;
    }

    @Transactional(readOnly = true)
    public AssigneeListResponse listAssignees(
            Long callerId,
            Long taskId,
            String search,
            Integer page,
            Integer perPage
    ) {
        Long listId = taskRepository.findTaskListIdById(taskId)
                .orElseThrow(() -> AssigneeProblems.taskNotFound(taskId));
        if (!accessPolicy.canRead(listId, callerId)) {
            throw AssigneeProblems.noReadAccess(taskId);
        }

        int pageNumber = (page == null || page < 1) ? 1 : page;
        int pageSize = properties.resolvePageSize(perPage);
        long offset = (long) (pageNumber - 1) * pageSize;

        AssigneeSearchResult result = assigneeStore.search(taskId, search, pageSize, offset);
        List<AssigneeResponse> items = result.rows().stream()
                .map(AssigneeResponse::from)
                .toList();
        int totalPages = (int) ((result.totalCount() + pageSize - 1) / pageSize);
        return new AssigneeListResponse(items, pageNumber, pageSize, items.size(), result.totalCount(), totalPages);
    }

    /**
     * Runs outside a service transaction; {@link BulkAssigneeTransaction} owns commit and rollback.
     */
    public BulkAssigneesResponse replaceAssignees(Long callerId, Long taskId, BulkAssigneesRequest request) {
        resolveWritableList(callerId, taskId);
        return BulkAssigneesResponse.from(bulkAssigneeTransaction.runReconciliation(taskId, request.userIds()));
    }

    private Long resolveWritableList(Long callerId, Long taskId) {
        Long listId = taskRepository.findTaskListIdById(taskId)
                .orElseThrow(() -> AssigneeProblems.taskNotFound(taskId));
        if (!accessPolicy.canWrite(listId, callerId)) {
            throw AssigneeProblems.noWriteAccess(taskId);
        }
        return listId;
    }

    private static Long requireValidUserId(Long userId) {
        if (userId == null || userId <= 0) {
            throw AssigneeProblems.invalidUserId(userId);
        }
        return userId;
    }
}
