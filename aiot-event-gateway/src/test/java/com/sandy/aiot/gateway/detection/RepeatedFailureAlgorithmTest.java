package com.sandy.aiot.gateway.detection;

import com.sandy.aiot.gateway.entity.DeviceEvent;
import com.sandy.aiot.gateway.vo.Pattern;
import com.sandy.aiot.gateway.vo.PatternType;
import com.sandy.aiot.gateway.vo.Severity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.sandy.aiot.gateway.TestEvents.event;
import static org.junit.jupiter.api.Assertions.*;

class RepeatedFailureAlgorithmTest {

    private final RepeatedFailureAlgorithm algorithm = new RepeatedFailureAlgorithm();
    private final Instant t = Instant.parse("2025-03-01T00:00:00Z");

    private DetectionWindow failures(int count) {
        List<DeviceEvent> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(event("d1", "healthCheck", "healthStatus", i % 2 == 0 ? "OFFLINE" : "error", t.plusSeconds(i * 60L)));
            events.add(event("d1", "healthCheck", "healthStatus", "online", t.plusSeconds(i * 60L + 30)));
        }
        return new DetectionWindow("d1", events, ZoneOffset.UTC);
    }

    @Test
    void moreThanThreeFailuresIsWarning() {
        Pattern p = algorithm.detect(failures(4)).orElseThrow();
        assertEquals(PatternType.REPEATED_FAILURE, p.getType());
        assertEquals(Severity.WARNING, p.getSeverity());
        assertEquals(0.9, p.getConfidence());
        assertEquals(4, p.getOccurrences());
        assertTrue(p.getDescription().contains("healthStatus"));
    }

    @Test
    void threeFailuresAreTolerated() {
        assertTrue(algorithm.detect(failures(3)).isEmpty());
    }
}
