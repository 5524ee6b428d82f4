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
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Rapid reversals of a state attribute (on/off, locked/unlocked ...), the usual footprint of
 * two automations fighting over one device.
 * <ul>
 *   <li>reversal in under 5s: critical, 0.95 (0.98 when it happened between 01:00 and 05:59 local)</li>
 *   <li>5s to 10s: warning, 0.85</li>
 *   <li>10s or more: ignored</li>
 * </ul>
 */
@Component
public class AutomationConflictAlgorithm implements PatternAlgorithm {

    static final long IMMEDIATE_MS = 5_000;
    static final long RAPID_MS = 10_000;

    private static final Set<String> STATE_ATTRIBUTES = Set.of("switch", "lock", "contact", "door", "valve", "windowShade");

    @Override
    public String name() {
        return "automation-conflict";
    }

    @Override
    public int minimumEvents() {
        return 2;
    }

    @Override
    public Optional<Pattern> detect(DetectionWindow window) {
        Map<String, DeviceEvent> lastByAttribute = new LinkedHashMap<>();
        List<DeviceEvent> involved = new ArrayList<>();
        int rapid = 0;
        int immediate = 0;
        int oddHour = 0;
        long gapSum = 0;
        long minGap = Long.MAX_VALUE;

        for (DeviceEvent e : window.events()) {
            if (e.getAttribute() == null || !STATE_ATTRIBUTES.contains(e.getAttribute())) continue;
            String key = e.getComponent() + "/" + e.getAttribute();
            DeviceEvent prev = lastByAttribute.put(key, e);
            if (prev == null) continue;
            String before = prev.typedValue().asText().orElse(null);
            String after = e.typedValue().asText().orElse(null);
            if (Objects.equals(before, after)) continue;
            long gap = e.getSequenceEpoch() - prev.getSequenceEpoch();
            if (gap >= RAPID_MS) continue;
            rapid++;
            gapSum += gap;
            minGap = Math.min(minGap, gap);
            if (gap < IMMEDIATE_MS) {
                immediate++;
                int hour = DetectionWindow.timeOf(e).atZone(window.zone()).getHour();
                if (hour >= 1 && hour <= 5) oddHour++;
            }
            if (involved.isEmpty() || involved.get(involved.size() - 1) != prev) involved.add(prev);
            involved.add(e);
        }
        if (rapid == 0) return Optional.empty();

        Severity severity;
        double confidence;
        if (immediate > 0) {
            severity = Severity.CRITICAL;
            confidence = oddHour > 0 ? 0.98 : 0.95;
        } else {
            severity = Severity.WARNING;
            confidence = 0.85;
        }

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("rapidChanges", (double) rapid);
        metrics.put("immediateReversals", (double) immediate);
        metrics.put("oddHourReversals", (double) oddHour);
        metrics.put("minGapMs", (double) minGap);
        metrics.put("avgGapMs", (double) gapSum / rapid);

        PatternEvidence evidence = PatternEvidence.builder()
                .start(DetectionWindow.timeOf(involved.get(0)))
                .end(DetectionWindow.timeOf(involved.get(involved.size() - 1)))
                .events(PatternEvidence.copyOf(involved))
                .metrics(metrics)
                .build();

        List<String> recommendations = new ArrayList<>();
        recommendations.add("Review automations and scenes that control this device for conflicting triggers");
        if (oddHour > 0) {
            recommendations.add("State changes happened between 1am and 5am; check scheduled routines");
        }
        recommendations.add("Add a condition or delay so only one automation acts on the device at a time");

        return Optional.of(Pattern.of(PatternType.AUTOMATION_CONFLICT, severity, confidence, rapid,
                Set.of(window.deviceId()),
                "Detected " + rapid + " rapid state change(s) (" + immediate + " within 5s, avg "
                        + Math.round(gapSum / (double) rapid / 1000.0) + "s gap)",
                evidence, recommendations));
    }
}
