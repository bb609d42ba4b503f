package com.todolist.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.sql.SQLException;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Drives the handlers through the real guard, provider and repository against an in-memory database.
 */
@WebMvcTest({TodoController.class, MetricsController.class})
@Import({
    ConnectionProvider.class,
    SchemaInitializer.class,
    ReadinessGuard.class,
    TodoRepository.class,
    TodoMetrics.class,
    MetricsConfig.class,
    TodoRoundTripTest.H2Config.class
})
class TodoRoundTripTest {

    private static final H2Database H2 = H2Database.create();

    @TestConfiguration
    static class H2Config {
        @Bean
        @Primary
        ConnectionOpener h2ConnectionOpener() {
            return H2.opener();
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void resetTable() throws SQLException {
        H2.dropTable();
        H2.createTable();
    }

    @Test
    void createdItemShowsUpInListWithParseableTimestamp() throws Exception {
        mockMvc.perform(post("/todos").contentType(MediaType.APPLICATION_JSON).content("{\"title\":\"Buy milk\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.title").value("Buy milk"));

        String body = mockMvc.perform(get("/todos"))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();

        JsonNode items = objectMapper.readTree(body);
        assertThat(items).hasSize(1);
        assertThat(items.get(0).get("title").asText()).isEqualTo("Buy milk");
        assertThat(items.get(0).get("id").asLong()).isPositive();
        assertThat(LocalDateTime.parse(items.get(0).get("created_at").asText())).isNotNull();
    }

    @Test
    void invalidBodiesInsertNothing() throws Exception {
        mockMvc.perform(post("/todos").contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(post("/todos").contentType(MediaType.APPLICATION_JSON).content("{\"title\":\"\"}"))
            .andExpect(status().isBadRequest());

        assertThat(H2.count()).isZero();
    }

    @Test
    void itemCountGaugeMatchesNumberOfCreatedItems() throws Exception {
        for (int i = 0; i < 3; i++) {
            mockMvc.perform(post("/todos").contentType(MediaType.APPLICATION_JSON).content("{\"title\":\"item " + i + "\"}"))
                .andExpect(status().isCreated());
        }

        mockMvc.perform(get("/todos")).andExpect(jsonPath("$.length()").value(3));
        mockMvc.perform(get("/metrics"))
            .andExpect(content().string(containsString("todo_items 3.0")));
    }
}
