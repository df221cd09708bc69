package com.taskboard.backend.modules.assignee.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;

import com.taskboard.backend.global.error.ProblemException;
import com.taskboard.backend.modules.assignee.domain.AssigneeDelta;
import com.taskboard.backend.modules.assignee.domain.AssigneeReconciler;
import com.taskboard.backend.modules.assignee.domain.ReconciliationStage;
import com.taskboard.backend.modules.assignee.infrastructure.persistence.AssigneeUserView;
import com.taskboard.backend.modules.auth.domain.AppUser;
import com.taskboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskRepository;
import com.taskboard.backend.modules.tasklist.infrastructure.persistence.TaskListRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Replaces the whole assignee set of a task inside one transaction.
 *
 * <p>Every addition is validated before the first write, so an unknown user or a user without
 * access to the list aborts the run with nothing written. Removals are applied before additions,
 * additions in ascending user id order, and the owning list is touched once per non-empty change.
 * The first failure is rethrown unchanged after rollback.</p>
 */
@Component
public class BulkAssigneeTransaction {

    private static final Logger log = LoggerFactory.getLogger(BulkAssigneeTransaction.class);

    private final TransactionTemplate transactionTemplate;
    private final TaskRepository taskRepository;
    private final TaskListRepository taskListRepository;
    private final AppUserRepository appUserRepository;
    private final TaskAssigneeStore assigneeStore;
    private final AssigneeAccessGate accessGate;
    private final Clock clock;

    public BulkAssigneeTransaction(
            PlatformTransactionManager transactionManager,
            TaskRepository taskRepository,
            TaskListRepository taskListRepository,
            AppUserRepository appUserRepository,
            TaskAssigneeStore assigneeStore,
            AssigneeAccessGate accessGate,
            Clock clock
    ) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.taskRepository = taskRepository;
        this.taskListRepository = taskListRepository;
        this.appUserRepository = appUserRepository;
        this.assigneeStore = assigneeStore;
        this.accessGate = accessGate;
        this.clock = clock;
    }

    public ReconciliationResult runReconciliation(Long taskId, Collection<Long> desiredUserIds) {
        Set<Long> desired = normalize(desiredUserIds);
        AtomicReference<ReconciliationStage> stage = new AtomicReference<>(ReconciliationStage.STARTED);
        ReconciliationResult result;
        try {
            result = transactionTemplate.execute(status -> reconcile(taskId, desired, stage));
        } catch (RuntimeException ex) {
            log.warn("Assignee replacement task={} {} while {} code={}",
                    taskId, ReconciliationStage.ROLLED_BACK, stage.get(), errorCode(ex));
            throw ex;
        }
        if (result == null) {
            throw new IllegalStateException("Assignee replacement for task " + taskId + " produced no result");
        }
        log.info("Assignee replacement committed task={} added={} removed={}",
                taskId, result.added().size(), result.removed().size());
        return result.withStage(ReconciliationStage.COMMITTED);
    }

    private ReconciliationResult reconcile(
            Long taskId,
            Set<Long> desired,
            AtomicReference<ReconciliationStage> stage
    ) {
        Long listId = taskRepository.findTaskListIdById(taskId)
                .orElseThrow(() -> AssigneeProblems.taskNotFound(taskId));
        Set<Long> current = assigneeStore.loadCurrent(taskId);
        stage.set(ReconciliationStage.LOADED);

        AssigneeDelta delta = AssigneeReconciler.reconcile(current, desired);
        stage.set(ReconciliationStage.DIFFED);

        if (delta.isEmpty()) {
            stage.set(ReconciliationStage.APPLIED);
            return ReconciliationResult.applied(taskId, listId, delta.toAdd(), delta.toRemove(),
                    assigneeStore.loadAssignees(taskId), false);
        }

        for (Long userId : delta.toAdd()) {
            AppUser user = appUserRepository.findById(userId)
                    .orElseThrow(() -> AssigneeProblems.userNotFound(userId));
            if (!accessGate.canAssign(user, listId)) {
                throw new AssigneeAccessDeniedException(listId, userId);
            }
        }
        stage.set(ReconciliationStage.VALIDATED);

        if (delta.clearAll()) {
            assigneeStore.deleteAll(taskId);
        } else {
            assigneeStore.deleteMany(taskId, delta.toRemove());
        }
        for (Long userId : delta.toAdd()) {
            assigneeStore.insert(taskId, userId);
        }
        taskListRepository.touchUpdatedAt(listId, OffsetDateTime.now(clock));
        stage.set(ReconciliationStage.APPLIED);

        List<AssigneeUserView> assignees = assigneeStore.loadAssignees(taskId);
        return ReconciliationResult.applied(taskId, listId, delta.toAdd(), delta.toRemove(), assignees, true);
    }

    private static Set<Long> normalize(Collection<Long> desiredUserIds) {
        Set<Long> desired = new TreeSet<>();
        if (desiredUserIds == null) {
            return desired;
        }
        for (Long userId : desiredUserIds) {
            if (userId == null || userId <= 0) {
                throw AssigneeProblems.invalidUserId(userId);
            }
            desired.add(userId);
        }
        return desired;
    }

    private static String errorCode(RuntimeException ex) {
        if (ex instanceof ProblemException problem) {
            return problem.getCode();
        }
        return ex.getClass().getSimpleName();
    }
}
