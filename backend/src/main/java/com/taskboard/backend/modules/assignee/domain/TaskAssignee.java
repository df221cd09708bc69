package com.taskboard.backend.modules.assignee.domain;

import com.taskboard.backend.global.jpa.AbstractCreatedEntity;
import com.taskboard.backend.modules.auth.domain.AppUser;
import com.taskboard.backend.modules.task.domain.Task;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.springframework.data.annotation.CreatedBy;

/**
 * One user assigned to one task. Rows are inserted and physically deleted, never updated.
 */
@Entity
@Table(
        name = "task_assignee",
        uniqueConstraints = @UniqueConstraint(name = "uq_task_assignee_task_user", columnNames = {"task_id", "user_id"})
)
public class TaskAssignee extends AbstractCreatedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "task_id", nullable = false, updatable = false)
    private Task task;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private AppUser user;

    @CreatedBy
    @Column(name = "created_by", updatable = false)
    private Long createdBy;

    protected TaskAssignee() {
    }

    public static TaskAssignee of(Task task, AppUser user) {
        TaskAssignee assignee = new TaskAssignee();
        assignee.task = task;
        assignee.user = user;
        return assignee;
    }

    public Long getId() {
        return id;
    }

    public Task getTask() {
        return task;
    }

    public AppUser getUser() {
        return user;
    }

    /**
     * Id of the user whose request created the assignment, or null when no user was authenticated.
     */
    public Long getCreatedBy() {
        return createdBy;
    }
}
