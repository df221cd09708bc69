package com.taskboard.backend.modules.tasklist.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.taskboard.backend.modules.tasklist.domain.ListShare;
import com.taskboard.backend.modules.tasklist.domain.SharePermission;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ListShareRepository extends JpaRepository<ListShare, Long> {

    boolean existsByTaskListIdAndUserId(Long taskListId, Long userId);

    boolean existsByTaskListIdAndUserIdAndPermission(Long taskListId, Long userId, SharePermission permission);

    Optional<ListShare> findByTaskListIdAndUserId(Long taskListId, Long userId);

    @Query("""
            select ls
              from ListShare ls
              join fetch ls.user
             where ls.taskList.id = :listId
             order by ls.id
            """)
    List<ListShare> findByTaskListIdWithUser(@Param("listId") Long listId);

    @Modifying
    @Query("delete from ListShare ls where ls.taskList.id = :listId and ls.user.id = :userId")
    int deleteByTaskListIdAndUserId(@Param("listId") Long listId, @Param("userId") Long userId);
}
