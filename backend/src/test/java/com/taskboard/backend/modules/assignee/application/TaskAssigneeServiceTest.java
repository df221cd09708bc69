package com.taskboard.backend.modules.assignee.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import com.taskboard.backend.global.config.AssigneeProperties;
import com.taskboard.backend.global.error.ProblemException;
import com.taskboard.backend.modules.assignee.domain.ReconciliationStage;
import com.taskboard.backend.modules.assignee.domain.TaskAssignee;
import com.taskboard.backend.modules.assignee.infrastructure.persistence.AssigneeSearchResult;
import com.taskboard.backend.modules.assignee.infrastructure.persistence.AssigneeUserView;
import com.taskboard.backend.modules.assignee.presentation.dto.AddAssigneeRequest;
import com.taskboard.backend.modules.assignee.presentation.dto.AssigneeListResponse;
import com.taskboard.backend.modules.assignee.presentation.dto.AssigneeReference;
import com.taskboard.backend.modules.assignee.presentation.dto.AssigneeResponse;
import com.taskboard.backend.modules.assignee.presentation.dto.BulkAssigneesRequest;
import com.taskboard.backend.modules.assignee.presentation.dto.BulkAssigneesResponse;
import com.taskboard.backend.modules.auth.domain.AppUser;
import com.taskboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskRepository;
import com.taskboard.backend.modules.tasklist.application.TaskListAccessPolicy;
import com.taskboard.backend.modules.tasklist.infrastructure.persistence.TaskListRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class TaskAssigneeServiceTest {

    private static final Long CALLER_ID = 1L;
    private static final Long TASK_ID = 20L;
    private static final Long LIST_ID = 4L;
    private static final Instant FIXED_NOW = Instant.parse("2026-02-10T12:00:00Z");

    @Mock
    private TaskRepository taskRepository;

    @Mock
    private TaskListRepository taskListRepository;

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private TaskListAccessPolicy accessPolicy;

    @Mock
    private AssigneeAccessGate accessGate;

    @Mock
    private TaskAssigneeStore assigneeStore;

    @Mock
    private BulkAssigneeTransaction bulkAssigneeTransaction;

    private TaskAssigneeService service;

    @BeforeEach
    void setUp() {
        service = new TaskAssigneeService(
                taskRepository,
                taskListRepository,
                appUserRepository,
                accessPolicy,
                accessGate,
                assigneeStore,
                bulkAssigneeTransaction,
                new AssigneeProperties(50, 250),
                Clock.fixed(FIXED_NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void addAssigneeInsertsAndTouchesList() {
        givenWritableTask();
        AppUser user = user(7L);
        when(appUserRepository.findById(7L)).thenReturn(Optional.of(user));
        when(accessGate.canAssign(user, LIST_ID)).thenReturn(true);
        TaskAssignee stored = TaskAssignee.of(null, user);
        ReflectionTestUtils.setField(stored, "createdAt", OffsetDateTime.ofInstant(FIXED_NOW, ZoneOffset.UTC));
        when(assigneeStore.insert(TASK_ID, 7L)).thenReturn(stored);

        AssigneeResponse response = service.addAssignee(CALLER_ID, TASK_ID, new AddAssigneeRequest(7L));

        assertThat(response.userId()).isEqualTo(7L);
        assertThat(response.username()).isEqualTo("user7");
        assertThat(response.assignedAt()).isEqualTo(OffsetDateTime.ofInstant(FIXED_NOW, ZoneOffset.UTC));
        verify(taskListRepository).touchUpdatedAt(LIST_ID, OffsetDateTime.ofInstant(FIXED_NOW, ZoneOffset.UTC));
    }

    @Test
    void addAssigneeRejectsUserWithoutListAccess() {
        givenWritableTask();
        AppUser user = user(7L);
        when(appUserRepository.findById(7L)).thenReturn(Optional.of(user));
        when(accessGate.canAssign(user, LIST_ID)).thenReturn(false);

        assertThatThrownBy(() -> service.addAssignee(CALLER_ID, TASK_ID, new AddAssigneeRequest(7L)))
                .isInstanceOf(AssigneeAccessDeniedException.class);

        verify(assigneeStore, never()).insert(anyLong(), anyLong());
        verify(taskListRepository, never()).touchUpdatedAt(anyLong(), any());
    }

    @Test
    void addAssigneeFailsForUnknownUser() {
        givenWritableTask();
        when(appUserRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.addAssignee(CALLER_ID, TASK_ID, new AddAssigneeRequest(99L)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("USER_NOT_FOUND"));
    }

    @Test
    void addAssigneeRequiresWriteAccessOnList() {
        when(taskRepository.findTaskListIdById(TASK_ID)).thenReturn(Optional.of(LIST_ID));
        when(accessPolicy.canWrite(LIST_ID, CALLER_ID)).thenReturn(false);

        assertThatThrownBy(() -> service.addAssignee(CALLER_ID, TASK_ID, new AddAssigneeRequest(7L)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("FORBIDDEN");
                    assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.FORBIDDEN);
                });

        verifyNoInteractions(assigneeStore);
    }

    @Test
    void addAssigneeRejectsNonPositiveUserId() {
        assertThatThrownBy(() -> service.addAssignee(CALLER_ID, TASK_ID, new AddAssigneeRequest(-3L)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVALID_USER_ID"));

        verifyNoInteractions(taskRepository, assigneeStore);
    }

    @Test
    void removingAbsentAssigneeSucceedsWithoutTouchingList() {
        givenWritableTask();
        when(assigneeStore.deleteOne(TASK_ID, 8L)).thenReturn(0);

        boolean removed = service.removeAssignee(CALLER_ID, TASK_ID, 8L);

        assertThat(removed).isFalse();
        verify(taskListRepository, never()).touchUpdatedAt(anyLong(), any());
    }

    @Test
    void removingPresentAssigneeTouchesList() {
        givenWritableTask();
        when(assigneeStore.deleteOne(TASK_ID, 8L)).thenReturn(1);

        boolean removed = service.removeAssignee(CALLER_ID, TASK_ID, 8L);

        assertThat(removed).isTrue();
        verify(taskListRepository).touchUpdatedAt(eq(LIST_ID), any());
    }

    @Test
    void removeOnMissingTaskFailsWithNotFound() {
        when(taskRepository.findTaskListIdById(TASK_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.removeAssignee(CALLER_ID, TASK_ID, 8L))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("TASK_NOT_FOUND"));
    }

    @Test
    void listAssigneesAppliesPagingDefaultsAndCap() {
        when(taskRepository.findTaskListIdById(TASK_ID)).thenReturn(Optional.of(LIST_ID));
        when(accessPolicy.canRead(LIST_ID, CALLER_ID)).thenReturn(true);
        when(assigneeStore.search(TASK_ID, "ann", 250, 250L))
                .thenReturn(new AssigneeSearchResult(List.of(view(5L)), 251L));

        AssigneeListResponse response = service.listAssignees(CALLER_ID, TASK_ID, "ann", 2, 1000);

        assertThat(response.page()).isEqualTo(2);
        assertThat(response.perPage()).isEqualTo(250);
        assertThat(response.resultCount()).isEqualTo(1);
        assertThat(response.totalCount()).isEqualTo(251L);
        assertThat(response.totalPages()).isEqualTo(2);
    }

    @Test
    void listAssigneesTreatsMissingPageAsFirst() {
        when(taskRepository.findTaskListIdById(TASK_ID)).thenReturn(Optional.of(LIST_ID));
        when(accessPolicy.canRead(LIST_ID, CALLER_ID)).thenReturn(true);
        when(assigneeStore.search(TASK_ID, null, 50, 0L)).thenReturn(new AssigneeSearchResult(List.of(), 0L));

        AssigneeListResponse response = service.listAssignees(CALLER_ID, TASK_ID, null, 0, null);

        assertThat(response.page()).isEqualTo(1);
        assertThat(response.items()).isEmpty();
        assertThat(response.totalPages()).isZero();
    }

    @Test
    void listAssigneesRequiresReadAccess() {
        when(taskRepository.findTaskListIdById(TASK_ID)).thenReturn(Optional.of(LIST_ID));
        when(accessPolicy.canRead(LIST_ID, CALLER_ID)).thenReturn(false);

        assertThatThrownBy(() -> service.listAssignees(CALLER_ID, TASK_ID, null, 1, 10))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.FORBIDDEN));

        verifyNoInteractions(assigneeStore);
    }

    @Test
    void replaceAssigneesDelegatesToBulkTransaction() {
        givenWritableTask();
        ReconciliationResult result = new ReconciliationResult(TASK_ID, LIST_ID, List.of(3L), List.of(),
                List.of(view(3L)), true, ReconciliationStage.COMMITTED);
        when(bulkAssigneeTransaction.runReconciliation(TASK_ID, List.of(3L, 3L))).thenReturn(result);

        BulkAssigneesResponse response = service.replaceAssignees(CALLER_ID, TASK_ID,
                new BulkAssigneesRequest(List.of(new AssigneeReference(3L), new AssigneeReference(3L))));

        assertThat(response.changed()).isTrue();
        assertThat(response.added()).containsExactly(3L);
        assertThat(response.assignees()).extracting(AssigneeResponse::userId).containsExactly(3L);
    }

    @Test
    void replaceAssigneesChecksCallerBeforeReconciling() {
        when(taskRepository.findTaskListIdById(TASK_ID)).thenReturn(Optional.of(LIST_ID));
        when(accessPolicy.canWrite(LIST_ID, CALLER_ID)).thenReturn(false);

        assertThatThrownBy(() -> service.replaceAssignees(CALLER_ID, TASK_ID,
                new BulkAssigneesRequest(List.of(new AssigneeReference(3L)))))
                .isInstanceOf(ProblemException.class);

        verifyNoInteractions(bulkAssigneeTransaction);
    }

    private void givenWritableTask() {
        when(taskRepository.findTaskListIdById(TASK_ID)).thenReturn(Optional.of(LIST_ID));
        when(accessPolicy.canWrite(LIST_ID, CALLER_ID)).thenReturn(true);
    }

    private static AppUser user(Long id) {
        AppUser user = new AppUser();
        ReflectionTestUtils.setField(user, "id", id);
        user.setUsername("user" + id);
        user.setFullName("User " + id);
        user.setEmail("user" + id + "@example.com");
        return user;
    }

    private static AssigneeUserView view(Long userId) {
        return new AssigneeUserView(userId, "user" + userId, "User " + userId, "user" + userId + "@example.com",
                OffsetDateTime.ofInstant(FIXED_NOW, ZoneOffset.UTC));
    }
}
