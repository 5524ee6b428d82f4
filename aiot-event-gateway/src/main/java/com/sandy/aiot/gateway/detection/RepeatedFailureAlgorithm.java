package com.sandy.aiot.gateway.detection;

import com.sandy.aiot.gateway.entity.DeviceEvent;
import com.sandy.aiot.gateway.vo.Pattern;
import com.sandy.aiot.gateway.vo.PatternEvidence;
import com.sandy.aiot.gateway.vo.PatternType;
import com.sandy.aiot.gateway.vo.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An attribute that reported offline / error / unavailable more than three times.
 */
@Component
public class RepeatedFailureAlgorithm implements PatternAlgorithm {

    static final int MAX_TOLERATED_FAILURES = 3;
    private static final Set<String> FAILURE_VALUES = Set.of("offline", "error", "unavailable");

    @Override
    public String name() {
        return "repeated-failure";
    }

    @Override
    public int minimumEvents() {
        return 3;
    }

    @Override
    public Optional<Pattern> detect(DetectionWindow window) {
        Map<String, List<DeviceEvent>> failures = new LinkedHashMap<>();
        for (DeviceEvent e : window.events()) {
            String value = e.typedValue().asText().orElse(null);
            if (value == null || !FAILURE_VALUES.contains(value.toLowerCase(Locale.ROOT))) continue;
            String attribute = e.getAttribute() == null ? "unknown" : e.getAttribute();
            failures.computeIfAbsent(attribute, k -> new ArrayList<>()).add(e);
        }
        String worst = null;
        List<DeviceEvent> worstEvents = List.of();
        for (Map.Entry<String, List<DeviceEvent>> entry : failures.entrySet()) {
            if (entry.getValue().size() > worstEvents.size()) {
                worst = entry.getKey();
                worstEvents = entry.getValue();
            }
        }
        if (worstEvents.size() <= MAX_TOLERATED_FAILURES) return Optional.empty();

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("failureCount", (double) worstEvents.size());
        metrics.put("failingAttributes", (double) failures.values().stream().filter(l -> l.size() > MAX_TOLERATED_FAILURES).count());
        PatternEvidence evidence = PatternEvidence.builder()
                .start(DetectionWindow.timeOf(worstEvents.get(0)))
                .end(DetectionWindow.timeOf(worstEvents.get(worstEvents.size() - 1)))
                .events(PatternEvidence.copyOf(worstEvents))
                .metrics(metrics)
                .build();
        return Optional.of(Pattern.of(PatternType.REPEATED_FAILURE, Severity.WARNING, 0.9, worstEvents.size(),
                Set.of(window.deviceId()),
                "Repeated failures detected: \"" + worst + "\" failed " + worstEvents.size() + " times",
                evidence,
                List.of("Power-cycle the device and check its integration status",
                        "If failures continue, re-pair the device or contact the manufacturer")));
    }
}
