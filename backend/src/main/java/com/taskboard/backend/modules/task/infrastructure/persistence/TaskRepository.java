package com.taskboard.backend.modules.task.infrastructure.persistence;

import java.util.Optional;

import com.taskboard.backend.modules.task.domain.Task;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskRepository extends JpaRepository<Task, Long> {

    @Query("select t.taskList.id from Task t where t.id = :taskId")
    Optional<Long> findTaskListIdById(@Param("taskId") Long taskId);
}
