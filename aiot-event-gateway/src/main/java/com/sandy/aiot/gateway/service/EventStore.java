package com.sandy.aiot.gateway.service;

import com.sandy.aiot.gateway.entity.DeviceEvent;
import com.sandy.aiot.gateway.tools.EventGaps;
import com.sandy.aiot.gateway.vo.EventPage;
import com.sandy.aiot.gateway.vo.EventQuery;
import com.sandy.aiot.gateway.vo.GapAnalysis;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only device event log, ordered per device by sequenceEpoch.
 */
public interface EventStore {

    /**
     * Stores the event unless one with the same id exists.
     *
     * @return true if stored, false for a replayed id
     */
    boolean append(DeviceEvent event);

    List<DeviceEvent> query(String deviceId, EventQuery query);

    EventPage queryPage(String deviceId, EventQuery query);

    /** Latest events across all devices. */
    List<DeviceEvent> recent(EventQuery query);

    /** Total for the same filters as {@link #recent(EventQuery)}, ignoring the limit. */
    long countRecent(EventQuery query);

    /** Events received (not event time) after the given instant. */
    long countReceivedSince(Instant since);

    long count(String deviceId, Instant since);

    List<String> knownDeviceIds();

    Optional<DeviceEvent> latest(String deviceId);

    Optional<DeviceEvent> latest(String deviceId, String capability, String attribute);

    List<String> capabilitiesOf(String deviceId);

    /** Deletes events older than the retention horizon; returns the number removed. */
    int purgeOlderThan(Instant cutoff);

    /**
     * Gap analysis over every event of the device in {@code [since, until]}, however many there are.
     * Null bounds are open.
     */
    GapAnalysis analyzeGaps(String deviceId, Instant since, Instant until, long thresholdMs);

    default GapAnalysis detectGaps(List<DeviceEvent> events, long thresholdMs) {
        return EventGaps.detectGaps(events, thresholdMs);
    }
}
