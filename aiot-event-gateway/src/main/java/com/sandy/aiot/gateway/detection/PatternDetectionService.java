package com.sandy.aiot.gateway.detection;

import com.sandy.aiot.gateway.config.ExecutorConfig;
import com.sandy.aiot.gateway.entity.DeviceEvent;
import com.sandy.aiot.gateway.service.EventStore;
import com.sandy.aiot.gateway.tools.ParallelTasks;
import com.sandy.aiot.gateway.tools.TaskOutcome;
import com.sandy.aiot.gateway.vo.EventQuery;
import com.sandy.aiot.gateway.vo.Pattern;
import com.sandy.aiot.gateway.vo.PatternDetectionResult;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Runs every registered {@link PatternAlgorithm} concurrently over one device's events.
 * A failing or slow algorithm is reported in {@code errors}; the others still count.
 */
@Service
@Slf4j
public class PatternDetectionService {

    private final List<PatternAlgorithm> algorithms;
    private final EventStore eventStore;
    private final Executor executor;

    @Value("${gateway.patterns.timeout-ms:400}")
    private long timeoutMs;
    @Value("${gateway.patterns.window-hours:24}")
    private int windowHours;
    @Value("${gateway.patterns.max-events:500}")
    private int maxEvents;
    @Value("${gateway.patterns.zone:}")
    private String zoneSetting;

    private ZoneId zone;

    public PatternDetectionService(List<PatternAlgorithm> algorithms,
                                   EventStore eventStore,
                                   @Qualifier(ExecutorConfig.PATTERN_EXECUTOR) Executor executor) {
        this.algorithms = List.copyOf(algorithms);
        this.eventStore = eventStore;
        this.executor = executor;
    }

    @PostConstruct
    public void init() {
        zone = zoneSetting == null || zoneSetting.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zoneSetting);
        log.info("Pattern detection initialized: algorithms={} timeoutMs={} windowHours={} zone={}",
                algorithms.stream().map(PatternAlgorithm::name).toList(), timeoutMs, windowHours, zone);
    }

    public List<PatternAlgorithm> algorithms() {
        return algorithms;
    }

    /** Loads the last {@code window-hours} of events for the device and analyses them. */
    public PatternDetectionResult detectForDevice(String deviceId) {
        Instant since = Instant.now().minus(Duration.ofHours(windowHours));
        List<DeviceEvent> events = eventStore.query(deviceId,
                EventQuery.builder().since(since).limit(maxEvents).order(EventQuery.Order.DESC).build());
        return detectAll(deviceId, events);
    }

    public PatternDetectionResult detectAll(String deviceId, List<DeviceEvent> events) {
        long start = System.currentTimeMillis();
        DetectionWindow window = new DetectionWindow(deviceId, events, zone);

        ParallelTasks tasks = new ParallelTasks(executor);
        for (PatternAlgorithm algorithm : algorithms) {
            if (window.size() < algorithm.minimumEvents()) continue;
            tasks.submit(algorithm.name(), () -> algorithm.detect(window).orElse(null));
        }
        Map<String, TaskOutcome<?>> outcomes = tasks.awaitAll(timeoutMs);

        List<Pattern> patterns = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        outcomes.forEach((name, outcome) -> {
            if (outcome.isSuccess()) {
                outcome.value().ifPresent(v -> patterns.add((Pattern) v));
            } else {
                errors.add(name + ": " + outcome.failureMessage());
                log.warn("Pattern algorithm failed deviceId={} algorithm={} reason={}", deviceId, name, outcome.failureMessage());
            }
        });
        patterns.sort(Pattern.BY_SEVERITY_THEN_CONFIDENCE);

        long elapsed = System.currentTimeMillis() - start;
        log.debug("Pattern detection deviceId={} events={} patterns={} errors={} durationMs={}",
                deviceId, window.size(), patterns.size(), errors.size(), elapsed);
        return PatternDetectionResult.builder()
                .deviceId(deviceId)
                .patterns(patterns)
                .eventsAnalyzed(window.size())
                .executionTimeMs(elapsed)
                .allAlgorithmsSucceeded(errors.isEmpty())
                .errors(errors)
                .build();
    }
}
