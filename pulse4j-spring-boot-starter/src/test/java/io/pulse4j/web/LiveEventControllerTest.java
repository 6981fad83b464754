package io.pulse4j.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pulse4j.hub.BroadcastHub;
import io.pulse4j.hub.ConnectionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;

class LiveEventControllerTest {

    private ConnectionRegistry registry;
    private BroadcastHub hub;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry(Duration.ofMinutes(5), 1);
        hub = new BroadcastHub(registry);
        mockMvc = MockMvcBuilders.standaloneSetup(
                new LiveEventController(registry, new ObjectMapper(), Duration.ZERO)).build();
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void subscribeShouldRegisterConnectionAndStreamPublishedEvents() throws Exception {
        MvcResult result = mockMvc.perform(get("/pulse/events/user-1"))
                .andExpect(request().asyncStarted())
                .andReturn();

        assertThat(registry.connections("user-1")).hasSize(1);
        assertThat(result.getResponse().getContentType()).startsWith("text/event-stream");

        assertThat(hub.publish("user-1", Map.of("type", "pick-graded"))).isEqualTo(1);

        String body = result.getResponse().getContentAsString();
        assertThat(body).startsWith("data: {").contains("\"connected\"");
        assertThat(body).endsWith("data: {\"type\":\"pick-graded\"}\n\n");
    }

    @Test
    void eachStreamShouldBeASeparateConnection() throws Exception {
        mockMvc.perform(get("/pulse/events/user-1")).andExpect(request().asyncStarted());
        mockMvc.perform(get("/pulse/events/user-1")).andExpect(request().asyncStarted());
        mockMvc.perform(get("/pulse/events/user-2")).andExpect(request().asyncStarted());

        assertThat(registry.connections("user-1")).hasSize(2);
        assertThat(registry.subscribers()).containsExactlyInAnyOrder("user-1", "user-2");
        assertThat(hub.publish("user-1", Map.of("type", "pick-graded"))).isEqualTo(2);
    }
}
