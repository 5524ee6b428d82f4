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
 * Latest battery reading in the window: below 10% critical, below 20% warning.
 */
@Component
public class BatteryDegradationAlgorithm implements PatternAlgorithm {

    static final double CRITICAL_LEVEL = 10;
    static final double WARNING_LEVEL = 20;

    @Override
    public String name() {
        return "battery-degradation";
    }

    @Override
    public int minimumEvents() {
        return 1;
    }

    @Override
    public Optional<Pattern> detect(DetectionWindow window) {
        List<DeviceEvent> events = window.events();
        DeviceEvent latest = null;
        double level = Double.NaN;
        for (int i = events.size() - 1; i >= 0; i--) {
            DeviceEvent e = events.get(i);
            if (!isBatteryReading(e)) continue;
            Optional<Double> v = e.typedValue().asDouble();
            if (v.isPresent()) {
                latest = e;
                level = v.get();
                break;
            }
        }
        if (latest == null || level >= WARNING_LEVEL) return Optional.empty();

        boolean critical = level < CRITICAL_LEVEL;
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("batteryLevel", level);
        PatternEvidence evidence = PatternEvidence.builder()
                .start(DetectionWindow.timeOf(latest))
                .end(DetectionWindow.timeOf(latest))
                .events(PatternEvidence.copyOf(List.of(latest)))
                .metrics(metrics)
                .build();
        String pct = formatLevel(level);
        return Optional.of(Pattern.of(PatternType.BATTERY_DEGRADATION,
                critical ? Severity.CRITICAL : Severity.WARNING,
                critical ? 0.98 : 0.95,
                1,
                Set.of(window.deviceId()),
                critical
                        ? "Critical battery level: " + pct + "% (immediate replacement needed)"
                        : "Low battery level: " + pct + "% (replacement recommended soon)",
                evidence,
                critical
                        ? List.of("Replace the battery now; the device may stop reporting at any time")
                        : List.of("Plan a battery replacement within the next few weeks")));
    }

    private static boolean isBatteryReading(DeviceEvent e) {
        return "battery".equals(e.getAttribute()) || ("battery".equals(e.getCapability()) && e.getAttribute() == null);
    }

    private static String formatLevel(double level) {
        return level == Math.rint(level) ? String.valueOf((long) level) : String.format("%.1f", level);
    }
}
