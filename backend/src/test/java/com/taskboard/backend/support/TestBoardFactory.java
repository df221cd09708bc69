package com.taskboard.backend.support;

import com.taskboard.backend.modules.auth.domain.AppUser;
import com.taskboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.taskboard.backend.modules.task.domain.Task;
import com.taskboard.backend.modules.task.infrastructure.persistence.TaskRepository;
import com.taskboard.backend.modules.tasklist.domain.ListShare;
import com.taskboard.backend.modules.tasklist.domain.SharePermission;
import com.taskboard.backend.modules.tasklist.domain.TaskList;
import com.taskboard.backend.modules.tasklist.infrastructure.persistence.ListShareRepository;
import com.taskboard.backend.modules.tasklist.infrastructure.persistence.TaskListRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class TestBoardFactory {

    private final TaskListRepository taskListRepository;
    private final ListShareRepository listShareRepository;
    private final TaskRepository taskRepository;
    private final AppUserRepository appUserRepository;

    public TestBoardFactory(
            TaskListRepository taskListRepository,
            ListShareRepository listShareRepository,
            TaskRepository taskRepository,
            AppUserRepository appUserRepository
    ) {
        this.taskListRepository = taskListRepository;
        this.listShareRepository = listShareRepository;
        this.taskRepository = taskRepository;
        this.appUserRepository = appUserRepository;
    }

    public TaskList createList(AppUser owner, String title) {
        TaskList list = new TaskList();
        list.setTitle(title);
        list.setOwner(appUserRepository.getReferenceById(owner.getId()));
        return taskListRepository.saveAndFlush(list);
    }

    public void share(TaskList list, AppUser user, SharePermission permission) {
        ListShare share = new ListShare();
        share.setTaskList(taskListRepository.getReferenceById(list.getId()));
        share.setUser(appUserRepository.getReferenceById(user.getId()));
        share.setPermission(permission);
        listShareRepository.saveAndFlush(share);
    }

    public Task createTask(TaskList list, String title) {
        Task task = new Task();
        task.setTaskList(taskListRepository.getReferenceById(list.getId()));
        task.setTitle(title);
        task.setDone(false);
        return taskRepository.saveAndFlush(task);
    }
}
