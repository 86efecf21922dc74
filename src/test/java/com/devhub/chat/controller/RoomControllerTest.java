package com.devhub.chat.controller;

import com.devhub.chat.IntegrationTestSupport;
import com.devhub.chat.model.UserAccount;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
public class RoomControllerTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void missingOrBadToken_isUnauthorized() throws Exception {
        mvc.perform(get("/api/rooms"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));
        mvc.perform(get("/api/rooms").header(HttpHeaders.AUTHORIZATION, "Bearer nope"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void createJoinPostAndRead() throws Exception {
        UserAccount alice = newAccount("alice");
        UserAccount bob = newAccount("bob");

        long roomId = createRoom(alice, "{\"name\":\"api-room\",\"maxParticipants\":5}");

        mvc.perform(post("/api/rooms/{id}/join", roomId).header(HttpHeaders.AUTHORIZATION, bearer(bob)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.room.memberCount").value(2));

        mvc.perform(post("/api/rooms/{id}/messages", roomId)
                        .header(HttpHeaders.AUTHORIZATION, bearer(bob))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"from rest\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.content").value("from rest"))
                .andExpect(jsonPath("$.senderId").value(bob.getId()));

        mvc.perform(get("/api/rooms/{id}/messages", roomId).header(HttpHeaders.AUTHORIZATION, bearer(alice)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)));
        mvc.perform(get("/api/rooms/{id}/messages/recent", roomId).header(HttpHeaders.AUTHORIZATION, bearer(alice)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].content").value("from rest"));
        mvc.perform(get("/api/rooms/{id}/members", roomId).header(HttpHeaders.AUTHORIZATION, bearer(alice)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));
        mvc.perform(get("/api/rooms/{id}/online", roomId).header(HttpHeaders.AUTHORIZATION, bearer(alice)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    void errorKinds_mapToStatuses() throws Exception {
        UserAccount alice = newAccount("alice");
        UserAccount eve = newAccount("eve");
        long roomId = createRoom(alice, "{\"name\":\"locked\",\"kind\":\"PRIVATE\"}");

        mvc.perform(post("/api/rooms/{id}/join", roomId).header(HttpHeaders.AUTHORIZATION, bearer(eve)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("PRIVATE_ROOM_DENIED"));
        mvc.perform(get("/api/rooms/{id}/messages", roomId).header(HttpHeaders.AUTHORIZATION, bearer(eve)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_A_MEMBER"));
        mvc.perform(post("/api/rooms/{id}/join", Long.MAX_VALUE).header(HttpHeaders.AUTHORIZATION, bearer(eve)))
                .andExpect(status().isNotFound());
        mvc.perform(post("/api/rooms")
                        .header(HttpHeaders.AUTHORIZATION, bearer(alice))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_NAME"));
        mvc.perform(post("/api/rooms/{id}/invitations", roomId)
                        .header(HttpHeaders.AUTHORIZATION, bearer(alice))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void inviteThenJoinPrivateRoom_andDeactivate() throws Exception {
        UserAccount alice = newAccount("alice");
        UserAccount bob = newAccount("bob");
        long roomId = createRoom(alice, "{\"name\":\"inner\",\"kind\":\"PRIVATE\"}");

        mvc.perform(post("/api/rooms/{id}/invitations", roomId)
                        .header(HttpHeaders.AUTHORIZATION, bearer(alice))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":" + bob.getId() + "}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.active").value(false));
        mvc.perform(post("/api/rooms/{id}/join", roomId).header(HttpHeaders.AUTHORIZATION, bearer(bob)))
                .andExpect(status().isOk());

        mvc.perform(delete("/api/rooms/{id}", roomId).header(HttpHeaders.AUTHORIZATION, bearer(bob)))
                .andExpect(status().isForbidden());
        mvc.perform(delete("/api/rooms/{id}", roomId).header(HttpHeaders.AUTHORIZATION, bearer(alice)))
                .andExpect(status().isNoContent());
        mvc.perform(get("/api/rooms").header(HttpHeaders.AUTHORIZATION, bearer(bob)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void directRoom_isSharedBothWays() throws Exception {
        UserAccount alice = newAccount("alice");
        UserAccount bob = newAccount("bob");

        MvcResult first = mvc.perform(post("/api/direct-rooms/{userId}", bob.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(alice)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.otherUserName").value(bob.getUsername()))
                .andReturn();
        long roomId = objectMapper.readTree(first.getResponse().getContentAsString()).path("room").path("id").asLong();

        mvc.perform(post("/api/direct-rooms/{userId}", alice.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(bob)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.room.id").value(roomId));
        mvc.perform(post("/api/direct-rooms/{userId}", alice.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(alice)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_RECIPIENT"));
    }

    private long createRoom(UserAccount owner, String body) throws Exception {
        MvcResult result = mvc.perform(post("/api/rooms")
                        .header(HttpHeaders.AUTHORIZATION, bearer(owner))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn();
        JsonNode room = objectMapper.readTree(result.getResponse().getContentAsString());
        return room.path("id").asLong();
    }

    private String bearer(UserAccount account) {
        return "Bearer " + account.getAccessToken();
    }
}
