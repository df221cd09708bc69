package com.taskboard.backend.modules.tasklist;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskboard.backend.modules.assignee.infrastructure.persistence.TaskAssigneeRepository;
import com.taskboard.backend.modules.auth.domain.AppUser;
import com.taskboard.backend.support.AbstractPostgresIntegrationTest;
import com.taskboard.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class TaskListIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PASSWORD = "secret1!";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private TaskAssigneeRepository taskAssigneeRepository;

    private AppUser member;
    private String ownerToken;

    @BeforeEach
    void setUp() throws Exception {
        testUserFactory.ensureUser("olga", PASSWORD);
        member = testUserFactory.ensureUser("pete", PASSWORD);
        ownerToken = login("olga");
    }

    @Test
    void ownerSharesListAndMemberCanReadIt() throws Exception {
        long listId = createList("Groceries");

        mockMvc.perform(put("/lists/" + listId + "/shares")
                        .header("Authorization", "Bearer " + ownerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": " + member.getId() + ", \"permission\": \"READ\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.permission").value("READ"));

        mockMvc.perform(get("/lists/" + listId)
                        .header("Authorization", "Bearer " + login("pete")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Groceries"))
                .andExpect(jsonPath("$.shares.length()").value(1));
    }

    @Test
    void strangerCannotReadUnsharedList() throws Exception {
        long listId = createList("Private");

        mockMvc.perform(get("/lists/" + listId)
                        .header("Authorization", "Bearer " + login("pete")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    @Test
    void revokedShareRemovesAccess() throws Exception {
        long listId = createList("Shared once");
        mockMvc.perform(put("/lists/" + listId + "/shares")
                        .header("Authorization", "Bearer " + ownerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": " + member.getId() + ", \"permission\": \"WRITE\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(delete("/lists/" + listId + "/shares/" + member.getId())
                        .header("Authorization", "Bearer " + ownerToken))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/lists/" + listId)
                        .header("Authorization", "Bearer " + login("pete")))
                .andExpect(status().isForbidden());
    }

    @Test
    void deletingTaskRemovesItsAssignees() throws Exception {
        long listId = createList("Chores");
        MvcResult created = mockMvc.perform(post("/lists/" + listId + "/tasks")
                        .header("Authorization", "Bearer " + ownerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"Take out trash\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.done").value(false))
                .andReturn();
        long taskId = readId(created, "taskId");

        AppUser owner = testUserFactory.ensureUser("olga", PASSWORD);
        mockMvc.perform(put("/tasks/" + taskId + "/assignees")
                        .header("Authorization", "Bearer " + ownerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": " + owner.getId() + "}"))
                .andExpect(status().isCreated());

        mockMvc.perform(delete("/tasks/" + taskId)
                        .header("Authorization", "Bearer " + ownerToken))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/tasks/" + taskId)
                        .header("Authorization", "Bearer " + ownerToken))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("TASK_NOT_FOUND"));
        assertThat(taskAssigneeRepository.findUserIdsByTaskId(taskId)).isEmpty();
    }

    @Test
    void creatingTaskInMissingListReturnsNotFound() throws Exception {
        mockMvc.perform(post("/lists/424242/tasks")
                        .header("Authorization", "Bearer " + ownerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"Orphan\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("LIST_NOT_FOUND"));
    }

    private long createList(String title) throws Exception {
        MvcResult result = mockMvc.perform(post("/lists")
                        .header("Authorization", "Bearer " + ownerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"" + title + "\"}"))
                .andExpect(status().isCreated())
                .andReturn();
        return readId(result, "listId");
    }

    private long readId(MvcResult result, String field) throws Exception {
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.path(field).asLong();
    }

    private String login(String username) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"" + username + "\", \"password\": \"" + PASSWORD + "\"}"))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString())
                .path("token").path("accessToken").asText();
    }
}
