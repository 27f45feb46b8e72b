package com.proxyhub.aggregator.api;

import com.proxyhub.aggregator.model.SubscriptionSummary;
import com.proxyhub.aggregator.service.SubscriptionStore;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class SubscriptionApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private SubscriptionStore store;

    private MockMvc mockMvc;
    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
        for (SubscriptionSummary summary : store.list()) {
            store.removeById(summary.id());
        }
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void addListDetailAndRemove() throws Exception {
        String feed = "vless://user@host:443#NodeA\nvmess://abc@host2:8443#NodeB\ngarbage-line";
        server.enqueue(new MockResponse().setResponseCode(200)
            .setBody(Base64.getEncoder().encodeToString(feed.getBytes(StandardCharsets.UTF_8))));
        String url = server.url("/sub").toString();

        mockMvc.perform(post("/api/subscriptions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"url\": \"" + url + "\", \"name\": \"smoke\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.name").value("smoke"))
            .andExpect(jsonPath("$.configCount").value(2))
            .andExpect(jsonPath("$.lastFetchSuccess").value(true));

        String id = store.list().get(0).id();

        mockMvc.perform(get("/api/subscriptions"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)));

        mockMvc.perform(get("/api/subscriptions/" + id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.endpoints", hasSize(2)))
            .andExpect(jsonPath("$.endpoints[0].name").value("NodeA"))
            .andExpect(jsonPath("$.endpoints[0].lastLatency").value(-1));

        mockMvc.perform(get("/api/endpoints").param("minSuccessRate", "0.5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(0))
            .andExpect(jsonPath("$.diagnostic").value("NO_TESTED_ENDPOINTS"));

        mockMvc.perform(get("/api/endpoints").param("protocol", "vmess"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.endpoints[0].name").value("NodeB"));

        mockMvc.perform(delete("/api/subscriptions/" + id))
            .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/subscriptions/" + id))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void duplicateAndInvalidUrlsAreBadRequests() throws Exception {
        String url = server.url("/dup").toString();
        String body = "{\"url\": \"" + url + "\", \"fetchNow\": false}";

        mockMvc.perform(post("/api/subscriptions").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isCreated());
        mockMvc.perform(post("/api/subscriptions").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("validation_error"));
        mockMvc.perform(post("/api/subscriptions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"url\": \"ftp://example.com/sub\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void updateDistinguishesParseAndFetchFailures() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("not a config"));
        server.enqueue(new MockResponse().setResponseCode(503));
        String url = server.url("/feed").toString();
        mockMvc.perform(post("/api/subscriptions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"url\": \"" + url + "\", \"fetchNow\": false}"))
            .andExpect(status().isCreated());
        String id = store.list().get(0).id();

        mockMvc.perform(post("/api/subscriptions/" + id + "/update"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("parse_error"));
        mockMvc.perform(post("/api/subscriptions/" + id + "/update"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.error").value("fetch_error"))
            .andExpect(jsonPath("$.reasonCode").value("HTTP_5XX"));
        mockMvc.perform(get("/api/subscriptions/" + id))
            .andExpect(jsonPath("$.subscription.failedUpdates").value(2));
    }

    @Test
    void invalidRequestsAreRejected() throws Exception {
        mockMvc.perform(get("/api/subscriptions/does-not-exist"))
            .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/endpoints").param("minSuccessRate", "1.5"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/endpoints").param("name", "[broken"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/probe").contentType(MediaType.APPLICATION_JSON).content("{\"descriptor\": \" \"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void rankingWithEmptyStoreReturnsEmptyList() throws Exception {
        mockMvc.perform(post("/api/endpoints/rank").contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(0)));
        mockMvc.perform(post("/api/probe/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"descriptors\": [\"vless://\"], \"timeoutSeconds\": 1}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(0)));
    }
}
