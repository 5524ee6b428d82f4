package com.sandy.aiot.gateway.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.gateway.entity.DeviceEvent;
import com.sandy.aiot.gateway.entity.QueueJob;
import com.sandy.aiot.gateway.service.EventStore;
import com.sandy.aiot.gateway.service.JobHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Stores a queued device event and pushes it to live subscribers. Replays of an already
 * stored id are a no-op, which keeps at-least-once delivery from duplicating events.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DeviceEventJobHandler implements JobHandler {

    public static final String TYPE = "device_event";

    private final ObjectMapper objectMapper;
    private final EventStore eventStore;
    private final BroadcastHub broadcastHub;

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public void handle(QueueJob job) throws Exception {
        DeviceEvent event = objectMapper.readValue(job.getPayload(), DeviceEvent.class);
        if (!eventStore.append(event)) {
            log.debug("Replayed device event skipped jobId={} eventId={}", job.getId(), event.getId());
            return;
        }
        broadcastHub.publish(event).whenComplete((n, err) -> {
            if (err != null) {
                log.warn("Broadcast failed eventId={} error={}", event.getId(), err.getMessage());
            }
        });
    }
}
