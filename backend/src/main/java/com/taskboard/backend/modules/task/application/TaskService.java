package com.taskboard.backend.modules.task.application;

import static org.springframework.http.HttpStatus.FORBIDDEN;
import static org.springframework.http.HttpStatus.NOT_FOUND;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.taskboard.backend.global.error.ProblemException;
import com.taskboard.backend.modules.task.domain.Task;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskRepository;
import com.taskboard.backend.modules.task.presentation.dto.CreateTaskRequest;
import com.taskboard.backend.modules.task.presentation.dto.TaskResponse;
import com.taskboard.backend.modules.tasklist.application.TaskListAccessPolicy;
import com.taskboard.backend.modules.tasklist.domain.TaskList;
import com.taskboard.backend.modules.tasklist.infrastructure.persistence.TaskListRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class TaskService {

    private final TaskRepository taskRepository;
    private final TaskListRepository taskListRepository;
    private final TaskListAccessPolicy accessPolicy;
    private final Clock clock;

    public TaskService(
            TaskRepository taskRepository,
            TaskListRepository taskListRepository,
            TaskListAccessPolicy accessPolicy,
            Clock clock
    ) {
        this.taskRepository = taskRepository;
        this.taskListRepository = taskListRepository;
        this.accessPolicy = accessPolicy;
        this.clock = clock;
    }

    public TaskResponse createTask(Long callerId, Long listId, CreateTaskRequest request) {
        TaskList list = taskListRepository.findById(listId)
                .orElseThrow(() -> new ProblemException(NOT_FOUND, "LIST_NOT_FOUND",
                        "List %d does not exist".formatted(listId)));
        if (!accessPolicy.canWrite(listId, callerId)) {
            throw new ProblemException(FORBIDDEN, "FORBIDDEN", "No write access to list %d".formatted(listId));
        }
        Task task = new Task();
        task.setTaskList(list);
        task.setTitle(request.title().trim());
        task.setDescription(request.description());
        task.setDone(false);
        taskRepository.saveAndFlush(task);
        TaskResponse response = TaskResponse.from(task, listId);
        taskListRepository.touchUpdatedAt(listId, OffsetDateTime.now(clock));
        return response;
    }

    @Transactional(readOnly = true)
    public TaskResponse getTask(Long callerId, Long taskId) {
        Task task = loadTask(taskId);
        Long listId = task.getTaskList().getId();
        if (!accessPolicy.canRead(listId, callerId)) {
            throw new ProblemException(FORBIDDEN, "FORBIDDEN", "No read access to task %d".formatted(taskId));
        }
        return TaskResponse.from(task, listId);
    }

    public void deleteTask(Long callerId, Long taskId) {
        Task task = loadTask(taskId);
        Long listId = task.getTaskList().getId();
        if (!accessPolicy.canWrite(listId, callerId)) {
            throw new ProblemException(FORBIDDEN, "FORBIDDEN", "No write access to task %d".formatted(taskId));
        }
        taskRepository.delete(task);
        taskRepository.flush();
        taskListRepository.touchUpdatedAt(listId, OffsetDateTime.now(clock));
    }

    private Task loadTask(Long taskId) {
        return taskRepository.findById(taskId)
                .orElseThrow(() -> new ProblemException(NOT_FOUND, "TASK_NOT_FOUND",
                        "Task %d does not exist".formatted(taskId)));
    }
}
