package com.taskboard.backend.modules.tasklist.presentation;

import com.taskboard.backend.global.security.SecurityUtils;
import com.taskboard.backend.modules.tasklist.application.TaskListService;
import com.taskboard.backend.modules.tasklist.presentation.dto.CreateTaskListRequest;
import com.taskboard.backend.modules.tasklist.presentation.dto.ListShareResponse;
import com.taskboard.backend.modules.tasklist.presentation.dto.ShareListRequest;
import com.taskboard.backend.modules.tasklist.presentation.dto.TaskListResponse;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/lists")
public class TaskListController {

    private final TaskListService taskListService;

    public TaskListController(TaskListService taskListService) {
        this.taskListService = taskListService;
    }

    @PostMapping
    public ResponseEntity<TaskListResponse> createList(@Valid @RequestBody CreateTaskListRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(taskListService.createList(SecurityUtils.getCurrentUserId(), request));
    }

    @GetMapping("/{listId}")
    public ResponseEntity<TaskListResponse> getList(@PathVariable("listId") Long listId) {
        return ResponseEntity.ok(taskListService.getList(SecurityUtils.getCurrentUserId(), listId));
    }

    @PutMapping("/{listId}/shares")
    public ResponseEntity<ListShareResponse> shareList(
            @PathVariable("listId") Long listId,
            @Valid @RequestBody ShareListRequest request
    ) {
        return ResponseEntity.ok(taskListService.shareList(SecurityUtils.getCurrentUserId(), listId, request));
    }

    @DeleteMapping("/{listId}/shares/{userId}")
    public ResponseEntity<Void> revokeShare(
            @PathVariable("listId") Long listId,
            @PathVariable("userId") Long userId
    ) {
        taskListService.revokeShare(SecurityUtils.getCurrentUserId(), listId, userId);
        return ResponseEntity.noContent().build();
    }
}
