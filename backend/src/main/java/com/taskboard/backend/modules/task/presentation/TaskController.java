package com.taskboard.backend.modules.task.presentation;

import com.taskboard.backend.global.security.SecurityUtils;
import com.taskboard.backend.modules.task.application.TaskService;
import com.taskboard.backend.modules.task.presentation.dto.CreateTaskRequest;
import com.taskboard.backend.modules.task.presentation.dto.TaskResponse;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TaskController {

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @PostMapping("/lists/{listId}/tasks")
    public ResponseEntity<TaskResponse> createTask(
            @PathVariable("listId") Long listId,
            @Valid @RequestBody CreateTaskRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(taskService.createTask(SecurityUtils.getCurrentUserId(), listId, request));
    }

    @GetMapping("/tasks/{taskId}")
    public ResponseEntity<TaskResponse> getTask(@PathVariable("taskId") Long taskId) {
        return ResponseEntity.ok(taskService.getTask(SecurityUtils.getCurrentUserId(), taskId));
    }

    @DeleteMapping("/tasks/{taskId}")
    public ResponseEntity<Void> deleteTask(@PathVariable("taskId") Long taskId) {
        taskService.deleteTask(SecurityUtils.getCurrentUserId(), taskId);
        return ResponseEntity.noContent().build();
    }
}
