package com.sandy.aiot.gateway.detection;

import com.sandy.aiot.gateway.entity.DeviceEvent;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Read-only, sequenceEpoch-ascending view of the events being analysed for one device.
 */
public final class DetectionWindow {

    private final String deviceId;
    private final List<DeviceEvent> events;
    private final ZoneId zone;

    public DetectionWindow(String deviceId, List<DeviceEvent> events, ZoneId zone) {
        this.deviceId = deviceId;
        List<DeviceEvent> sorted = new ArrayList<>(events == null ? List.of() : events);
        sorted.sort(Comparator.comparingLong(DeviceEvent::getSequenceEpoch));
        this.events = Collections.unmodifiableList(sorted);
        this.zone = zone == null ? ZoneId.systemDefault() : zone;
    }

    public String deviceId() { return deviceId; }

    public List<DeviceEvent> events() { return events; }

    public ZoneId zone() { return zone; }

    public int size() { return events.size(); }

    public boolean isEmpty() { return events.isEmpty(); }

    public Instant start() {
        return events.isEmpty() ? null : timeOf(events.get(0));
    }

    public Instant end() {
        return events.isEmpty() ? null : timeOf(events.get(events.size() - 1));
    }

    public long spanMs() {
        if (events.size() < 2) return 0;
        return events.get(events.size() - 1).getSequenceEpoch() - events.get(0).getSequenceEpoch();
    }

    static Instant timeOf(DeviceEvent e) {
        return e.getTimestamp() != null ? e.getTimestamp() : Instant.ofEpochMilli(e.getSequenceEpoch());
    }
}
