package com.sandy.aiot.gateway;

import com.sandy.aiot.gateway.entity.JobStatus;
import com.sandy.aiot.gateway.entity.QueueJob;
import com.sandy.aiot.gateway.repository.DeviceEventRepository;
import com.sandy.aiot.gateway.repository.QueueJobRepository;
import com.sandy.aiot.gateway.service.EventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static com.sandy.aiot.gateway.TestEvents.temperature;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class EventApiTest {
    @Autowired MockMvc mockMvc;
    @Autowired EventStore eventStore;
    @Autowired DeviceEventRepository eventRepository;
    @Autowired QueueJobRepository jobRepository;

    private final Instant t = Instant.now().minus(Duration.ofHours(3)).truncatedTo(ChronoUnit.SECONDS);

    @BeforeEach
    void setUp() {
        eventRepository.deleteAll();
        jobRepository.deleteAll();
        eventStore.append(temperature("sensor-1", 20, t));
        eventStore.append(temperature("sensor-1", 21, t.plus(Duration.ofMinutes(30))));
        eventStore.append(temperature("sensor-1", 22, t.plus(Duration.ofMinutes(95))));
        eventStore.append(temperature("sensor-2", 18, t.plus(Duration.ofMinutes(5))));
    }

    @Test
    void deviceEventsCarryPagingMetadata() throws Exception {
        mockMvc.perform(get("/api/events/device/sensor-1").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deviceId", is("sensor-1")))
                .andExpect(jsonPath("$.count", is(2)))
                .andExpect(jsonPath("$.totalCount", is(3)))
                .andExpect(jsonPath("$.hasMore", is(true)))
                .andExpect(jsonPath("$.gapDetected", is(true)))
                .andExpect(jsonPath("$.events", hasSize(2)))
                .andExpect(jsonPath("$.events[0].value", is(22.0)));

        mockMvc.perform(get("/api/events/device/sensor-1").param("order", "asc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.events[0].value", is(20.0)))
                .andExpect(jsonPath("$.hasMore", is(false)));
    }

    @Test
    void gapsEndpointFlagsSuspiciousGap() throws Exception {
        mockMvc.perform(get("/api/events/device/sensor-1/gaps").param("thresholdMs", "3600000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.gaps", hasSize(1)))
                .andExpect(jsonPath("$.gaps[0].durationText", is("1h 5m")))
                .andExpect(jsonPath("$.gaps[0].suspicious", is(true)))
                .andExpect(jsonPath("$.suspiciousGaps", hasSize(1)));

        mockMvc.perform(get("/api/events/device/sensor-1/gaps").param("thresholdMs", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("BAD_REQUEST")));
    }

    @Test
    void gapsEndpointSeesTheWholeWindowOfABusyDevice() throws Exception {
        Instant start = Instant.now().minus(Duration.ofHours(23)).truncatedTo(ChronoUnit.SECONDS);
        for (int i = 0; i < 600; i++) {
            eventStore.append(temperature("busy", 20, start.plus(Duration.ofMinutes(i))));
        }
        eventStore.append(temperature("busy", 21, Instant.now().minus(Duration.ofHours(1))));

        mockMvc.perform(get("/api/events/device/busy/gaps").param("hours", "24"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.thresholdMs", is(3600000)))
                .andExpect(jsonPath("$.gaps", hasSize(1)))
                .andExpect(jsonPath("$.gaps[0].durationText", startsWith("12h")))
                .andExpect(jsonPath("$.suspiciousGaps", hasSize(1)));
    }

    @Test
    void recentEventsAcrossDevices() throws Exception {
        mockMvc.perform(get("/api/events").param("limit", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count", is(3)))
                .andExpect(jsonPath("$.totalCount", is(4)));

        mockMvc.perform(get("/api/events").param("source", "bogus"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void statsSummariseStoreAndQueue() throws Exception {
        mockMvc.perform(get("/api/events/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalEvents", is(4)))
                .andExpect(jsonPath("$.knownDevices", is(2)))
                .andExpect(jsonPath("$.queue.pending", is(0)))
                .andExpect(jsonPath("$.connectedClients", greaterThanOrEqualTo(0)));
    }

    @Test
    void streamOpensWithConnectedEvent() throws Exception {
        MvcResult result = mockMvc.perform(get("/api/events/stream").accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(request().asyncStarted())
                .andReturn();
        String body = result.getResponse().getContentAsString();
        assertTrue(body.contains("event:connected"), body);

        mockMvc.perform(get("/api/events/stream/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.connectedClients", greaterThanOrEqualTo(1)));
    }

    @Test
    void failedJobRetryEndpoints() throws Exception {
        Instant now = Instant.now();
        QueueJob failed = jobRepository.save(QueueJob.builder().type("device_event").payload("{}")
                .attempts(3).maxAttempts(3).status(JobStatus.FAILED).lastError("IOException: disk full")
                .nextRunAt(now).createdAt(now).updatedAt(now).completedAt(now).build());

        mockMvc.perform(get("/api/queue/failed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].lastError", is("IOException: disk full")));

        mockMvc.perform(post("/api/queue/failed/" + failed.getId() + "/retry"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("PENDING")))
                .andExpect(jsonPath("$.attempts", is(0)));

        mockMvc.perform(post("/api/queue/failed/" + failed.getId() + "/retry"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/queue/failed/999999/retry"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code", is("NOT_FOUND")));

        mockMvc.perform(get("/api/queue/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pending", is(1)))
                .andExpect(jsonPath("$.failed", is(0)));
    }
}
