package com.sandy.aiot.gateway.controller;

import com.sandy.aiot.gateway.entity.DeviceEvent;
import com.sandy.aiot.gateway.service.EventStore;
import com.sandy.aiot.gateway.service.impl.BroadcastHub;
import com.sandy.aiot.gateway.service.impl.DurableJobQueue;
import com.sandy.aiot.gateway.vo.EventPage;
import com.sandy.aiot.gateway.vo.EventQuery;
import com.sandy.aiot.gateway.vo.GapAnalysis;
import com.sandy.aiot.gateway.vo.QueueStats;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Stored-event queries and the live event stream.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventController {

    private final EventStore eventStore;
    private final BroadcastHub broadcastHub;
    private final DurableJobQueue jobQueue;

    @Value("${gateway.events.gap-threshold-ms:3600000}")
    private long defaultGapThresholdMs;

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream() {
        return broadcastHub.subscribe().getEmitter();
    }

    @GetMapping("/stream/status")
    public Map<String, Object> streamStatus() {
        return Map.of("connectedClients", broadcastHub.connectedClients(), "timestamp", Instant.now().toString());
    }

    @GetMapping
    public RecentEvents recent(@RequestParam(defaultValue = "50") int limit,
                               @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since,
                               @RequestParam(required = false) String source) {
        EventQuery query = EventQuery.builder().since(since).limit(limit).source(source).order(EventQuery.Order.DESC).build();
        RecentEvents r = new RecentEvents();
        r.setEvents(eventStore.recent(query));
        r.setCount(r.getEvents().size());
        r.setTotalCount(eventStore.countRecent(query));
        return r;
    }

    @GetMapping("/device/{deviceId}")
    public EventPage deviceEvents(@PathVariable String deviceId,
                                  @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since,
                                  @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant until,
                                  @RequestParam(defaultValue = "50") int limit,
                                  @RequestParam(defaultValue = "desc") String order) {
        EventQuery query = EventQuery.builder()
                .since(since)
                .until(until)
                .limit(limit)
                .order(parseOrder(order))
                .build();
        return eventStore.queryPage(deviceId, query);
    }

    @GetMapping("/device/{deviceId}/gaps")
    public GapAnalysis gaps(@PathVariable String deviceId,
                            @RequestParam(required = false) Long thresholdMs,
                            @RequestParam(defaultValue = "24") int hours) {
        long threshold = thresholdMs != null ? thresholdMs : defaultGapThresholdMs;
        if (threshold <= 0) throw new IllegalArgumentException("thresholdMs must be > 0");
        if (hours <= 0) throw new IllegalArgumentException("hours must be > 0");
        Instant since = Instant.now().minus(Duration.ofHours(hours));
        return eventStore.analyzeGaps(deviceId, since, null, threshold);
    }

    @GetMapping("/stats")
    public Stats stats() {
        Stats s = new Stats();
        s.setQueue(jobQueue.stats());
        s.setTotalEvents(eventStore.count(null, null));
        s.setEventsLastHour(eventStore.countReceivedSince(Instant.now().minus(Duration.ofHours(1))));
        s.setKnownDevices(eventStore.knownDeviceIds().size());
        s.setConnectedClients(broadcastHub.connectedClients());
        return s;
    }

    private static EventQuery.Order parseOrder(String order) {
        try {
            return EventQuery.Order.valueOf(order.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("order must be asc or desc");
        }
    }

    @Data
    public static class RecentEvents {
        private int count;
        private long totalCount;
        private List<DeviceEvent> events;
    }

    @Data
    public static class Stats {
        private QueueStats queue;
        private long totalEvents;
        private long eventsLastHour;
        private int knownDevices;
        private int connectedClients;
    }
}
