package com.sandy.aiot.gateway.tools;

import com.sandy.aiot.gateway.entity.DeviceEvent;
import com.sandy.aiot.gateway.vo.EventGap;
import com.sandy.aiot.gateway.vo.GapAnalysis;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.sandy.aiot.gateway.TestEvents.temperature;
import static org.junit.jupiter.api.Assertions.*;

class EventGapsTest {

    private static final long HOUR = Duration.ofHours(1).toMillis();
    private final Instant t = Instant.parse("2025-03-01T10:00:00Z");

    @Test
    void flagsOnlyTheIntervalLongerThanThreshold() {
        List<DeviceEvent> events = List.of(
                temperature("d1", 20, t),
                temperature("d1", 21, t.plus(Duration.ofMinutes(30))),
                temperature("d1", 22, t.plus(Duration.ofMinutes(95))));

        GapAnalysis analysis = EventGaps.detectGaps(events, HOUR);

        assertEquals(1, analysis.getGaps().size());
        assertEquals(1, analysis.getSuspiciousGaps().size());
        EventGap gap = analysis.getGaps().get(0);
        assertEquals(t.plus(Duration.ofMinutes(30)), gap.getStart());
        assertEquals(t.plus(Duration.ofMinutes(95)), gap.getEnd());
        assertEquals(Duration.ofMinutes(65).toMillis(), gap.getDurationMs());
        assertEquals("1h 5m", gap.getDurationText());
        assertTrue(gap.isSuspicious());
    }

    @Test
    void sortsBySequenceEpochBeforeMeasuring() {
        List<DeviceEvent> events = List.of(
                temperature("d1", 22, t.plus(Duration.ofMinutes(95))),
                temperature("d1", 20, t),
                temperature("d1", 21, t.plus(Duration.ofMinutes(30))));

        assertEquals(1, EventGaps.detectGaps(events, HOUR).getGaps().size());
    }

    @Test
    void gapsBelowOneHourAreReportedButNotSuspicious() {
        List<DeviceEvent> events = List.of(
                temperature("d1", 20, t),
                temperature("d1", 21, t.plus(Duration.ofMinutes(45))));

        GapAnalysis analysis = EventGaps.detectGaps(events, Duration.ofMinutes(30).toMillis());

        assertEquals(1, analysis.getGaps().size());
        assertFalse(analysis.hasSuspiciousGap());
    }

    @Test
    void intervalEqualToThresholdIsNotAGap() {
        List<DeviceEvent> events = List.of(temperature("d1", 20, t), temperature("d1", 21, t.plusMillis(HOUR)));
        assertTrue(EventGaps.detectGaps(events, HOUR).getGaps().isEmpty());
    }

    @Test
    void fewerThanTwoEventsYieldNothing() {
        assertTrue(EventGaps.detectGaps(List.of(), HOUR).getGaps().isEmpty());
        assertTrue(EventGaps.detectGaps(List.of(temperature("d1", 20, t)), HOUR).getGaps().isEmpty());
        assertTrue(EventGaps.detectGaps(null, HOUR).getGaps().isEmpty());
    }

    @Test
    void formatsDurations() {
        assertEquals("45s", EventGaps.formatDuration(45_000));
        assertEquals("5m", EventGaps.formatDuration(5 * 60_000));
        assertEquals("5m 30s", EventGaps.formatDuration(5 * 60_000 + 30_000));
        assertEquals("3h", EventGaps.formatDuration(3 * HOUR));
        assertEquals("2h 30m", EventGaps.formatDuration(2 * HOUR + 30 * 60_000));
        assertEquals("2d", EventGaps.formatDuration(48 * HOUR));
        assertEquals("1d 6h", EventGaps.formatDuration(30 * HOUR));
    }
}
