package com.taskboard.backend.modules.assignee.application;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import com.taskboard.backend.modules.assignee.domain.TaskAssignee;
import com.taskboard.backend.modules.assignee.infrastructure.persistence.AssigneeSearchCondition;
import com.taskboard.backend.modules.assignee.infrastructure.persistence.AssigneeSearchResult;
import com.taskboard.backend.modules.assignee.infrastructure.persistence.AssigneeUserView;
import com.taskboard.backend.modules.assignee.infrastructure.persistence.TaskAssigneeRepository;
import com.taskboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskRepository;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * Row-level access to task assignments. Callers own the transaction; every method joins it.
 */
@Component
public class TaskAssigneeStore {

    private final TaskAssigneeRepository assigneeRepository;
    private final TaskRepository taskRepository;
    private final AppUserRepository appUserRepository;

    public TaskAssigneeStore(
            TaskAssigneeRepository assigneeRepository,
            TaskRepository taskRepository,
            AppUserRepository appUserRepository
    ) {
        this.assigneeRepository = assigneeRepository;
        this.taskRepository = taskRepository;
        this.appUserRepository = appUserRepository;
    }

    /**
     * Inserts one assignment. A pair that already exists, checked up front or reported by the
     * unique constraint when a concurrent writer got there first, fails with ASSIGNEE_ALREADY_EXISTS.
     */
    public TaskAssignee insert(Long taskId, Long userId) {
        if (assigneeRepository.existsByTaskIdAndUserId(taskId, userId)) {
            throw AssigneeProblems.alreadyAssigned(taskId, userId, null);
        }
        TaskAssignee assignee = TaskAssignee.of(
                taskRepository.getReferenceById(taskId),
                appUserRepository.getReferenceById(userId)
        );
        try {
            return assigneeRepository.saveAndFlush(assignee);
        } catch (DataIntegrityViolationException ex) {
            throw AssigneeProblems.alreadyAssigned(taskId, userId, ex);
        }
    }

    public int deleteOne(Long taskId, Long userId) {
        return assigneeRepository.removeForTask(taskId, userId);
    }

    public int deleteMany(Long taskId, Collection<Long> userIds) {
        if (userIds.isEmpty()) {
            return 0;
        }
        return assigneeRepository.removeManyForTask(taskId, userIds);
    }

    public int deleteAll(Long taskId) {
        return assigneeRepository.removeAllForTask(taskId);
    }

    public Set<Long> loadCurrent(Long taskId) {
        return new TreeSet<>(assigneeRepository.findUserIdsByTaskId(taskId));
    }

    public List<AssigneeUserView> loadAssignees(Long taskId) {
        return assigneeRepository.findWithUserByTaskId(taskId).stream()
                .map(AssigneeUserView::from)
                .toList();
    }

    public AssigneeSearchResult search(Long taskId, String keyword, int limit, long offset) {
        return assigneeRepository.searchAssignees(new AssigneeSearchCondition(taskId, keyword, limit, offset));
    }
}
