package com.jimin.blog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.RequestBuilder;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * H2 위에서 Controller → Service → Repository 전체 흐름 확인
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class BlogApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void postLifecycle() throws Exception {
        UUID postId = createPost("Integration post", "Body");

        mockMvc.perform(asyncDispatch(start(get("/api/post/{id}", postId))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Integration post"))
                .andExpect(jsonPath("$.content").value("Body"));

        mockMvc.perform(asyncDispatch(start(put("/api/post/{id}", postId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Edited\",\"content\":\"New body\"}"))))
                .andExpect(status().isOk());

        mockMvc.perform(asyncDispatch(start(get("/api/post/{id}", postId))))
                .andExpect(jsonPath("$.title").value("Edited"));

        mockMvc.perform(asyncDispatch(start(delete("/api/post/{id}", postId))))
                .andExpect(status().isOk());
        mockMvc.perform(asyncDispatch(start(delete("/api/post/{id}", postId))))
                .andExpect(status().isBadRequest());
    }

    @Test
    void commentLifecycle() throws Exception {
        UUID postId = createPost("Post with comments", "Body");

        MvcResult created = mockMvc.perform(asyncDispatch(start(post("/api/comment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"Nice post!\",\"postId\":\"" + postId + "\"}"))))
                .andExpect(status().isCreated())
                .andReturn();
        UUID commentId = idOf(created);

        mockMvc.perform(asyncDispatch(start(get("/api/comment/{id}", commentId))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content").value("Nice post!"))
                .andExpect(jsonPath("$.postId").value(postId.toString()))
                .andExpect(jsonPath("$.author").value("Anonymous/System User"))
                .andExpect(jsonPath("$.createdAt").exists());

        mockMvc.perform(asyncDispatch(start(put("/api/comment/{id}", commentId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"Edited comment\",\"postId\":\"" + UUID.randomUUID() + "\"}"))))
                .andExpect(status().isOk());

        mockMvc.perform(asyncDispatch(start(get("/api/comment/{id}", commentId))))
                .andExpect(jsonPath("$.content").value("Edited comment"))
                .andExpect(jsonPath("$.postId").value(postId.toString()));

        mockMvc.perform(asyncDispatch(start(delete("/api/comment/{id}", commentId))))
                .andExpect(status().isNoContent());
        mockMvc.perform(asyncDispatch(start(delete("/api/comment/{id}", commentId))))
                .andExpect(status().isNotFound());
    }

    @Test
    void unknownPostIsNotFound() throws Exception {
        UUID id = UUID.randomUUID();

        MvcResult result = mockMvc.perform(asyncDispatch(start(get("/api/post/{id}", id))))
                .andExpect(status().isNotFound())
                .andReturn();

        assertThat(result.getResponse().getContentAsString()).contains(id.toString());
    }

    private UUID createPost(String title, String content) throws Exception {
        MvcResult result = mockMvc.perform(asyncDispatch(start(post("/api/post")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("title", title, "content", content))))))
                .andExpect(status().isOk())
                .andReturn();
        return idOf(result);
    }

    private UUID idOf(MvcResult result) throws Exception {
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return UUID.fromString(body.get("id").asText());
    }

    private MvcResult start(RequestBuilder builder) throws Exception {
        return mockMvc.perform(builder)
                .andExpect(request().asyncStarted())
                .andReturn();
    }
}
