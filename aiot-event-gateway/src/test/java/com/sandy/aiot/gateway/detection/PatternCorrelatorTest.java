package com.sandy.aiot.gateway.detection;

import com.sandy.aiot.gateway.vo.Pattern;
import com.sandy.aiot.gateway.vo.PatternEvidence;
import com.sandy.aiot.gateway.vo.PatternType;
import com.sandy.aiot.gateway.vo.Severity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PatternCorrelatorTest {

    private final PatternCorrelator correlator = new PatternCorrelator();

    private static Pattern gap(String deviceId, double confidence) {
        Instant t = Instant.parse("2025-03-01T00:00:00Z");
        return Pattern.of(PatternType.CONNECTIVITY_GAP, Severity.WARNING, confidence, 1, Set.of(deviceId),
                "gap on " + deviceId, PatternEvidence.builder().start(t).end(t.plusSeconds(7200)).build(),
                List.of("Check the hub"));
    }

    private static Map<String, List<Pattern>> gapsOn(int devices) {
        Map<String, List<Pattern>> byDevice = new LinkedHashMap<>();
        for (int i = 1; i <= devices; i++) {
            byDevice.put("d" + i, List.of(gap("d" + i, 0.8)));
        }
        return byDevice;
    }

    @Test
    void singleDeviceIsNotCorrelated() {
        assertTrue(correlator.correlate(gapsOn(1)).isEmpty());
    }

    @Test
    void twoDevicesAreLowImpact() {
        List<Pattern> findings = correlator.correlate(gapsOn(2));
        assertEquals(1, findings.size());
        assertEquals(Severity.INFO, findings.get(0).getSeverity());
        assertTrue(findings.get(0).getDescription().contains("impact LOW"));
    }

    @Test
    void threeDevicesAreMediumImpact() {
        assertEquals(Severity.WARNING, correlator.correlate(gapsOn(3)).get(0).getSeverity());
    }

    @Test
    void fiveDevicesAreHighImpactAndAllListed() {
        Pattern finding = correlator.correlate(gapsOn(5)).get(0);
        assertEquals(Severity.CRITICAL, finding.getSeverity());
        assertEquals(Set.of("d1", "d2", "d3", "d4", "d5"), finding.getAffectedDevices());
        assertEquals(5, finding.getOccurrences());
        assertEquals(0.8, finding.getConfidence(), 1e-9);
        assertEquals(5.0, finding.getEvidence().getMetrics().get("deviceCount"));
    }

    @Test
    void automationConflictOnFiveDevicesIsHighImpact() {
        Instant t = Instant.parse("2025-03-01T03:00:00Z");
        Map<String, List<Pattern>> byDevice = new LinkedHashMap<>();
        for (String id : List.of("lamp-1", "lamp-2", "plug-1", "plug-2", "lock-1")) {
            byDevice.put(id, List.of(Pattern.of(PatternType.AUTOMATION_CONFLICT, Severity.CRITICAL, 0.98, 2, Set.of(id),
                    "switch toggled within 3s on " + id, PatternEvidence.builder().start(t).end(t.plusSeconds(3)).build(),
                    List.of("Review automations targeting " + id))));
        }

        List<Pattern> findings = correlator.correlate(byDevice);

        assertEquals(1, findings.size());
        Pattern finding = findings.get(0);
        assertEquals(PatternType.AUTOMATION_CONFLICT, finding.getType());
        assertEquals(Severity.CRITICAL, finding.getSeverity());
        assertTrue(finding.getDescription().contains("impact HIGH"));
        assertEquals(Set.of("lamp-1", "lamp-2", "plug-1", "plug-2", "lock-1"), finding.getAffectedDevices());
        assertEquals(10, finding.getOccurrences());
        assertEquals(0.98, finding.getConfidence(), 1e-9);
    }

    @Test
    void sixDevicesStayHighImpact() {
        assertEquals(Severity.CRITICAL, correlator.correlate(gapsOn(6)).get(0).getSeverity());
    }

    @Test
    void differentTypesAreNotMerged() {
        Map<String, List<Pattern>> byDevice = new LinkedHashMap<>();
        byDevice.put("d1", List.of(gap("d1", 0.8)));
        byDevice.put("d2", List.of(Pattern.of(PatternType.BATTERY_DEGRADATION, Severity.WARNING, 0.95, 1,
                Set.of("d2"), "low battery", null, List.of())));
        assertTrue(correlator.correlate(byDevice).isEmpty());
    }
}
