package com.sandy.aiot.gateway.provider.impl;

import com.sandy.aiot.gateway.entity.DeviceEvent;
import com.sandy.aiot.gateway.provider.DeviceHealthProvider;
import com.sandy.aiot.gateway.service.EventStore;
import com.sandy.aiot.gateway.vo.DeviceHealth;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Health derived from stored events: offline when silent for {@code offline-after-hours} or when
 * the last health-check event said so; warning when the battery is below 20%.
 */
@Component
@RequiredArgsConstructor
public class EventStoreDeviceHealthProvider implements DeviceHealthProvider {

    static final double LOW_BATTERY = 20;

    private final EventStore eventStore;

    @Value("${gateway.health.offline-after-hours:24}")
    private int offlineAfterHours;

    @Override
    public DeviceHealth getHealth(String deviceId) {
        DeviceEvent last = eventStore.latest(deviceId)
                .orElseThrow(() -> new NoSuchElementException("Unknown device: " + deviceId));
        Instant lastActivity = last.getTimestamp();
        boolean recent = lastActivity != null
                && lastActivity.isAfter(Instant.now().minus(Duration.ofHours(offlineAfterHours)));
        boolean reportedOffline = eventStore.latest(deviceId, "healthCheck", "healthStatus")
                .flatMap(e -> e.typedValue().asText())
                .map(s -> s.toLowerCase(Locale.ROOT).equals("offline"))
                .orElse(false);
        boolean online = recent && !reportedOffline;
        Double battery = eventStore.latest(deviceId, "battery", "battery")
                .flatMap(e -> e.typedValue().asDouble())
                .orElse(null);

        DeviceHealth.Status status;
        if (!online) {
            status = DeviceHealth.Status.OFFLINE;
        } else if (battery != null && battery < LOW_BATTERY) {
            status = DeviceHealth.Status.WARNING;
        } else {
            status = DeviceHealth.Status.ONLINE;
        }
        return DeviceHealth.builder()
                .deviceId(deviceId)
                .online(online)
                .batteryLevel(battery)
                .lastActivity(lastActivity)
                .status(status)
                .build();
    }
}
