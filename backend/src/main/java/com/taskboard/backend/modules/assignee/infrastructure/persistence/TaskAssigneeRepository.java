package com.taskboard.backend.modules.assignee.infrastructure.persistence;

import java.util.Collection;
import java.util.List;

import com.taskboard.backend.modules.assignee.domain.TaskAssignee;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskAssigneeRepository extends JpaRepository<TaskAssignee, Long>, TaskAssigneeRepositoryCustom {

    boolean existsByTaskIdAndUserId(Long taskId, Long userId);

    @Query("select ta.user.id from TaskAssignee ta where ta.task.id = :taskId order by ta.user.id")
    List<Long> findUserIdsByTaskId(@Param("taskId") Long taskId);

    @Query("""
            select ta
              from TaskAssignee ta
              join fetch ta.user u
             where ta.task.id = :taskId
             order by lower(u.username), u.id
            """)
    List<TaskAssignee> findWithUserByTaskId(@Param("taskId") Long taskId);

    @Modifying(flushAutomatically = true)
    @Query("delete from TaskAssignee ta where ta.task.id = :taskId and ta.user.id = :userId")
    int removeForTask(@Param("taskId") Long taskId, @Param("userId") Long userId);

    @Modifying(flushAutomatically = true)
    @Query("delete from TaskAssignee ta where ta.task.id = :taskId and ta.user.id in :userIds")
    int removeManyForTask(@Param("taskId") Long taskId, @Param("userIds") Collection<Long> userIds);

    @Modifying(flushAutomatically = true)
    @Query("delete from TaskAssignee ta where ta.task.id = :taskId")
    int removeAllForTask(@Param("taskId") Long taskId);
}
