package com.sandy.aiot.gateway.detection;

import com.sandy.aiot.gateway.entity.DeviceEvent;
import com.sandy.aiot.gateway.vo.Pattern;
import com.sandy.aiot.gateway.vo.PatternEvidence;
import com.sandy.aiot.gateway.vo.PatternType;
import com.sandy.aiot.gateway.vo.Severity;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Unusual event volume. Either more than 100 events per hour, measured over the window span
 * (at least one hour), or a burst of 20 events inside one minute.
 */
@Component
public class EventAnomalyAlgorithm implements PatternAlgorithm {

    static final double MAX_EVENTS_PER_HOUR = 100;
    static final int STORM_EVENTS = 20;
    static final long STORM_WINDOW_MS = 60_000;
    private static final long HOUR_MS = 3_600_000;

    @Override
    public String name() {
        return "event-anomaly";
    }

    @Override
    public int minimumEvents() {
        return 10;
    }

    @Override
    public Optional<Pattern> detect(DetectionWindow window) {
        List<DeviceEvent> events = window.events();
        double hours = Math.max(window.spanMs(), HOUR_MS) / (double) HOUR_MS;
        double rate = events.size() / hours;
        int stormStart = findStorm(events);
        boolean highRate = rate > MAX_EVENTS_PER_HOUR;
        if (!highRate && stormStart < 0) return Optional.empty();

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("eventsPerHour", rate);
        metrics.put("eventCount", (double) events.size());
        metrics.put("windowHours", hours);

        List<DeviceEvent> sample;
        String description;
        double confidence;
        if (stormStart >= 0) {
            sample = events.subList(stormStart, stormStart + STORM_EVENTS);
            metrics.put("stormEvents", (double) STORM_EVENTS);
            description = "Event storm detected: " + STORM_EVENTS + " events within 1 minute";
            confidence = 0.95;
        } else {
            sample = events.subList(Math.max(0, events.size() - PatternEvidence.MAX_EVENTS), events.size());
            description = String.format("Unusually high event rate: %.1f events/hour over %.1f hour(s)", rate, hours);
            confidence = 0.85;
        }

        PatternEvidence evidence = PatternEvidence.builder()
                .start(window.start())
                .end(window.end())
                .events(PatternEvidence.copyOf(sample))
                .metrics(metrics)
                .build();
        return Optional.of(Pattern.of(PatternType.EVENT_ANOMALY, Severity.WARNING, confidence, events.size(),
                Set.of(window.deviceId()), description, evidence,
                List.of("Check for a misbehaving sensor or an automation loop re-triggering the device",
                        "Consider raising the device's reporting interval")));
    }

    private static int findStorm(List<DeviceEvent> events) {
        for (int i = 0; i + STORM_EVENTS - 1 < events.size(); i++) {
            long span = events.get(i + STORM_EVENTS - 1).getSequenceEpoch() - events.get(i).getSequenceEpoch();
            if (span < STORM_WINDOW_MS) return i;
        }
        return -1;
    }
}
