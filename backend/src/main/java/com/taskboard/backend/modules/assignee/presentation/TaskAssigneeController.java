package com.taskboard.backend.modules.assignee.presentation;

import com.taskboard.backend.global.security.SecurityUtils;
import com.taskboard.backend.modules.assignee.application.TaskAssigneeService;
import com.taskboard.backend.modules.assignee.presentation.dto.AddAssigneeRequest;
import com.taskboard.backend.modules.assignee.presentation.dto.AssigneeListResponse;
import com.taskboard.backend.modules.assignee.presentation.dto.AssigneeResponse;
import com.taskboard.backend.modules.assignee.presentation.dto.BulkAssigneesRequest;
import com.taskboard.backend.modules.assignee.presentation.dto.BulkAssigneesResponse;
import com.taskboard.backend.modules.assignee.presentation.dto.MessageResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tasks/{taskId}/assignees")
@Tag(name = "Task assignees", description = "Users assigned to a task")
public class TaskAssigneeController {

    public static final String RESULT_COUNT_HEADER = "X-Pagination-Result-Count";
    public static final String TOTAL_PAGES_HEADER = "X-Pagination-Total-Pages";

    private final TaskAssigneeService assigneeService;

    public TaskAssigneeController(TaskAssigneeService assigneeService) {
        this.assigneeService = assigneeService;
    }

    @Operation(summary = "Assign a user to a task")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Assigned"),
            @ApiResponse(responseCode = "403", description = "Caller cannot edit the task or user cannot access the list"),
            @ApiResponse(responseCode = "404", description = "Task or user not found"),
            @ApiResponse(responseCode = "409", description = "User already assigned")
    })
    @PutMapping
    public ResponseEntity<AssigneeResponse> addAssignee(
            @PathVariable("taskId") Long taskId,
            @Valid @RequestBody AddAssigneeRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(assigneeService.addAssignee(SecurityUtils.getCurrentUserId(), taskId, request));
    }

    @Operation(summary = "Unassign a user from a task", description = "Succeeds even when the user was not assigned")
    @DeleteMapping("/{userId}")
    public ResponseEntity<MessageResponse> removeAssignee(
            @PathVariable("taskId") Long taskId,
            @PathVariable("userId") Long userId
    ) {
        assigneeService.removeAssignee(SecurityUtils.getCurrentUserId(), taskId, userId);
        return ResponseEntity.ok(new MessageResponse("The assignee was successfully deleted."));
    }

    @Operation(summary = "List task assignees", description = "Paged, optionally filtered by username substring")
    @GetMapping
    public ResponseEntity<AssigneeListResponse> listAssignees(
            @PathVariable("taskId") Long taskId,
            @RequestParam(name = "s", required = false) String search,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "per_page", required = false) Integer perPage
    ) {
        AssigneeListResponse response = assigneeService.listAssignees(
                SecurityUtils.getCurrentUserId(), taskId, search, page, perPage);
        return ResponseEntity.ok()
                .header(RESULT_COUNT_HEADER, String.valueOf(response.resultCount()))
                .header(TOTAL_PAGES_HEADER, String.valueOf(response.totalPages()))
                .body(response);
    }

    @Operation(summary = "Replace all assignees of a task", description = "All-or-nothing")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Assignee set after the replacement"),
            @ApiResponse(responseCode = "403", description = "A desired user cannot access the list"),
            @ApiResponse(responseCode = "404", description = "Task or a desired user not found")
    })
    @PostMapping("/bulk")
    public ResponseEntity<BulkAssigneesResponse> replaceAssignees(
            @PathVariable("taskId") Long taskId,
            @Valid @RequestBody BulkAssigneesRequest request
    ) {
        return ResponseEntity.ok(assigneeService.replaceAssignees(SecurityUtils.getCurrentUserId(), taskId, request));
    }
}
