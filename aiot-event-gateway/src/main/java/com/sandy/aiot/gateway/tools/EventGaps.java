package com.sandy.aiot.gateway.tools;

import com.sandy.aiot.gateway.entity.DeviceEvent;
import com.sandy.aiot.gateway.vo.EventGap;
import com.sandy.aiot.gateway.vo.GapAnalysis;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Gap detection over an event timeline.
 */
public final class EventGaps {

    /** Gaps longer than this are flagged as a likely connectivity issue. */
    public static final long SUSPICIOUS_GAP_MS = TimeUnit.HOURS.toMillis(1);

    private EventGaps() {
    }

    /**
     * Sorts by sequenceEpoch and reports every consecutive interval strictly longer than
     * {@code thresholdMs}. Input list is not modified.
     */
    public static GapAnalysis detectGaps(List<DeviceEvent> events, long thresholdMs) {
        if (events == null || events.size() < 2) return GapAnalysis.empty(thresholdMs);
        List<DeviceEvent> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparingLong(DeviceEvent::getSequenceEpoch));

        List<EventGap> gaps = new ArrayList<>();
        for (int i = 1; i < sorted.size(); i++) {
            DeviceEvent prev = sorted.get(i - 1);
            DeviceEvent cur = sorted.get(i);
            long delta = cur.getSequenceEpoch() - prev.getSequenceEpoch();
            if (delta > thresholdMs) gaps.add(gap(timeOf(prev), timeOf(cur), delta));
        }
        return analysis(gaps, thresholdMs);
    }

    /**
     * Same as {@link #detectGaps(List, long)} over bare sequenceEpoch values, which must be
     * ascending. Used when the whole timeline is too large to load as events.
     */
    public static GapAnalysis detectGapsInEpochs(List<Long> ascendingEpochs, long thresholdMs) {
        if (ascendingEpochs == null || ascendingEpochs.size() < 2) return GapAnalysis.empty(thresholdMs);
        List<EventGap> gaps = new ArrayList<>();
        long prev = ascendingEpochs.get(0);
        for (int i = 1; i < ascendingEpochs.size(); i++) {
            long cur = ascendingEpochs.get(i);
            long delta = cur - prev;
            if (delta > thresholdMs) gaps.add(gap(Instant.ofEpochMilli(prev), Instant.ofEpochMilli(cur), delta));
            prev = cur;
        }
        return analysis(gaps, thresholdMs);
    }

    private static EventGap gap(Instant start, Instant end, long delta) {
        return EventGap.builder()
                .start(start)
                .end(end)
                .durationMs(delta)
                .durationText(formatDuration(delta))
                .suspicious(delta > SUSPICIOUS_GAP_MS)
                .build();
    }

    private static GapAnalysis analysis(List<EventGap> gaps, long thresholdMs) {
        List<EventGap> suspicious = gaps.stream().filter(EventGap::isSuspicious).toList();
        return GapAnalysis.builder().thresholdMs(thresholdMs).gaps(gaps).suspiciousGaps(suspicious).build();
    }

    /** 45s, 5m 30s, 2h 30m, 1d 6h */
    public static String formatDuration(long durationMs) {
        long seconds = durationMs / 1000;
        long minutes = seconds / 60;
        long hours = minutes / 60;
        long days = hours / 24;
        if (days > 0) {
            long h = hours % 24;
            return h > 0 ? days + "d " + h + "h" : days + "d";
        }
        if (hours > 0) {
            long m = minutes % 60;
            return m > 0 ? hours + "h " + m + "m" : hours + "h";
        }
        if (minutes > 0) {
            long s = seconds % 60;
            return s > 0 ? minutes + "m " + s + "s" : minutes + "m";
        }
        return seconds + "s";
    }

    private static Instant timeOf(DeviceEvent e) {
        return e.getTimestamp() != null ? e.getTimestamp() : Instant.ofEpochMilli(e.getSequenceEpoch());
    }
}
