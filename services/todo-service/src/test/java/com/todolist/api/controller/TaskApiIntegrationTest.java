package com.todolist.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class TaskApiIntegrationTest extends ApiIntegrationTestSupport {

    @Test
    void aliceWalksThroughTheWholeTaskLifecycle() throws Exception {
        String username = uniqueUsername();
        JsonNode alice = register(username, username + "@x.com", "secret1");
        String token = login(username, "secret1");

        JsonNode task = createTask(token, "{\"title\": \"buy milk\"}");
        long taskId = task.get("id").asLong();
        assertThat(task.get("title").asText()).isEqualTo("buy milk");
        assertThat(task.get("completed").asBoolean()).isFalse();
        assertThat(task.get("owner_id").asLong()).isEqualTo(alice.get("id").asLong());

        mockMvc.perform(get("/tasks/").header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value(taskId))
                .andExpect(jsonPath("$[0].title").value("buy milk"));

        mockMvc.perform(put("/tasks/{id}", taskId)
                        .header(HttpHeaders.AUTHORIZATION, bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"completed\": true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.completed").value(true))
                .andExpect(jsonPath("$.title").value("buy milk"));

        mockMvc.perform(delete("/tasks/{id}", taskId).header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/tasks/{id}", taskId).header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Task not found."));
    }

    @Test
    void anotherUsersTaskLooksExactlyLikeAMissingOne() throws Exception {
        String aliceToken = newUserToken();
        String bobToken = newUserToken();
        long taskId = createTask(aliceToken, "{\"title\": \"alice only\"}").get("id").asLong();

        String bobGet = mockMvc.perform(get("/tasks/{id}", taskId).header(HttpHeaders.AUTHORIZATION, bearer(bobToken)))
                .andExpect(status().isNotFound())
                .andReturn().getResponse().getContentAsString();
        String missingGet = mockMvc.perform(get("/tasks/{id}", Long.MAX_VALUE)
                        .header(HttpHeaders.AUTHORIZATION, bearer(bobToken)))
                .andExpect(status().isNotFound())
                .andReturn().getResponse().getContentAsString();
        assertThat(bobGet).isEqualTo(missingGet);

        mockMvc.perform(put("/tasks/{id}", taskId)
                        .header(HttpHeaders.AUTHORIZATION, bearer(bobToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"hijacked\"}"))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete("/tasks/{id}", taskId).header(HttpHeaders.AUTHORIZATION, bearer(bobToken)))
                .andExpect(status().isNotFound());

        mockMvc.perform(get("/tasks/").header(HttpHeaders.AUTHORIZATION, bearer(bobToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
        mockMvc.perform(get("/tasks/{id}", taskId).header(HttpHeaders.AUTHORIZATION, bearer(aliceToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("alice only"));
    }

    @Test
    void partialUpdateKeepsOmittedFieldsAndClearsExplicitNulls() throws Exception {
        String token = newUserToken();
        JsonNode task = createTask(token,
                "{\"title\": \"report\", \"description\": \"quarterly\", \"due_date\": \"2030-01-31T17:00:00Z\"}");
        long taskId = task.get("id").asLong();
        Instant createdAt = Instant.parse(task.get("created_at").asText());

        String body = mockMvc.perform(put("/tasks/{id}", taskId)
                        .header(HttpHeaders.AUTHORIZATION, bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"completed\": true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("report"))
                .andExpect(jsonPath("$.description").value("quarterly"))
                .andExpect(jsonPath("$.due_date").value("2030-01-31T17:00:00Z"))
                .andExpect(jsonPath("$.completed").value(true))
                .andReturn().getResponse().getContentAsString();
        Instant updatedAt = Instant.parse(objectMapper.readTree(body).get("updated_at").asText());
        assertThat(updatedAt).isAfterOrEqualTo(createdAt);

        mockMvc.perform(put("/tasks/{id}", taskId)
                        .header(HttpHeaders.AUTHORIZATION, bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": null, \"due_date\": null}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("report"))
                .andExpect(jsonPath("$.description").doesNotExist())
                .andExpect(jsonPath("$.due_date").doesNotExist())
                .andExpect(jsonPath("$.completed").value(true));
    }

    @Test
    void dueDateWithoutOffsetIsStoredAsUtc() throws Exception {
        String token = newUserToken();

        JsonNode task = createTask(token, "{\"title\": \"local\", \"due_date\": \"2030-01-31T17:00:00\"}");

        assertThat(task.get("due_date").asText()).isEqualTo("2030-01-31T17:00:00Z");
        mockMvc.perform(post("/tasks/")
                        .header(HttpHeaders.AUTHORIZATION, bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"bad\", \"due_date\": \"tomorrow\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Malformed request body."));
    }

    @Test
    void deletingTwiceIsNotFoundTheSecondTime() throws Exception {
        String token = newUserToken();
        long taskId = createTask(token, "{\"title\": \"once\"}").get("id").asLong();

        mockMvc.perform(delete("/tasks/{id}", taskId).header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/tasks/{id}", taskId).header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete("/tasks/{id}", Long.MAX_VALUE).header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isNotFound());
    }

    @Test
    void taskEndpointsRequireAToken() throws Exception {
        mockMvc.perform(get("/tasks/")).andExpect(status().isUnauthorized());
        mockMvc.perform(post("/tasks/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"anonymous\"}"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/tasks/1")).andExpect(status().isUnauthorized());
        mockMvc.perform(delete("/tasks/1").header(HttpHeaders.AUTHORIZATION, bearer("not.a.token")))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void collectionPathWorksWithAndWithoutTrailingSlash() throws Exception {
        String token = newUserToken();
        createTask(token, "{\"title\": \"slash\"}");

        mockMvc.perform(get("/tasks").header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)));
    }

    @Test
    void invalidTaskInputIsRejected() throws Exception {
        String token = newUserToken();

        mockMvc.perform(post("/tasks/")
                        .header(HttpHeaders.AUTHORIZATION, bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"\"}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/tasks/")
                        .header(HttpHeaders.AUTHORIZATION, bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": \"no title\"}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/tasks/")
                        .header(HttpHeaders.AUTHORIZATION, bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"x\", \"description\": \"" + "d".repeat(1001) + "\"}"))
                .andExpect(status().isBadRequest());

        long taskId = createTask(token, "{\"title\": \"keep me\"}").get("id").asLong();
        mockMvc.perform(put("/tasks/{id}", taskId)
                        .header(HttpHeaders.AUTHORIZATION, bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": null}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/tasks/{id}", taskId).header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(jsonPath("$.title").value("keep me"));
        mockMvc.perform(get("/tasks/not-a-number").header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isBadRequest());
    }
}
