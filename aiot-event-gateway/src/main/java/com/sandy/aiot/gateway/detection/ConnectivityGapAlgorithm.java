package com.sandy.aiot.gateway.detection;

import com.sandy.aiot.gateway.tools.EventGaps;
import com.sandy.aiot.gateway.vo.EventGap;
import com.sandy.aiot.gateway.vo.GapAnalysis;
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
import java.util.concurrent.TimeUnit;

/**
 * Largest silence between consecutive events: over 1h is a warning, over 6h critical.
 */
@Component
public class ConnectivityGapAlgorithm implements PatternAlgorithm {

    static final long CRITICAL_GAP_MS = TimeUnit.HOURS.toMillis(6);

    @Override
    public String name() {
        return "connectivity-gap";
    }

    @Override
    public int minimumEvents() {
        return 2;
    }

    @Override
    public Optional<Pattern> detect(DetectionWindow window) {
        GapAnalysis analysis = EventGaps.detectGaps(window.events(), EventGaps.SUSPICIOUS_GAP_MS);
        if (!analysis.hasSuspiciousGap()) return Optional.empty();
        EventGap largest = analysis.largest().orElseThrow();
        boolean critical = largest.getDurationMs() > CRITICAL_GAP_MS;

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("gapCount", (double) analysis.getSuspiciousGaps().size());
        metrics.put("largestGapMs", (double) largest.getDurationMs());
        metrics.put("largestGapHours", largest.getDurationMs() / 3_600_000.0);

        PatternEvidence evidence = PatternEvidence.builder()
                .start(largest.getStart())
                .end(largest.getEnd())
                .events(PatternEvidence.copyOf(window.events().stream()
                        .filter(e -> !DetectionWindow.timeOf(e).isBefore(largest.getStart())
                                && !DetectionWindow.timeOf(e).isAfter(largest.getEnd()))
                        .toList()))
                .metrics(metrics)
                .build();

        List<String> recommendations = critical
                ? List.of("Device was silent for " + largest.getDurationText() + "; check power and network connectivity",
                          "Verify the hub or bridge the device reports through is online")
                : List.of("Check the device's signal strength or distance to the hub",
                          "Monitor for further gaps before replacing hardware");

        return Optional.of(Pattern.of(PatternType.CONNECTIVITY_GAP,
                critical ? Severity.CRITICAL : Severity.WARNING,
                critical ? 0.95 : 0.8,
                analysis.getSuspiciousGaps().size(),
                Set.of(window.deviceId()),
                "Found " + analysis.getSuspiciousGaps().size() + " connectivity gap(s) (largest: " + largest.getDurationText() + ")",
                evidence,
                recommendations));
    }
}
