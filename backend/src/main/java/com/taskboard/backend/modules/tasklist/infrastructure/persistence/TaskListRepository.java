package com.taskboard.backend.modules.tasklist.infrastructure.persistence;

import java.time.OffsetDateTime;

import com.taskboard.backend.modules.tasklist.domain.TaskList;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskListRepository extends JpaRepository<TaskList, Long> {

    boolean existsByIdAndOwnerId(Long id, Long ownerId);

    /**
     * Advances the last-modified marker without loading the list. Auditing does not run for
     * bulk updates, so the timestamp is passed in explicitly.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update TaskList tl set tl.updatedAt = :touchedAt where tl.id = :listId")
    int touchUpdatedAt(@Param("listId") Long listId, @Param("touchedAt") OffsetDateTime touchedAt);
}
