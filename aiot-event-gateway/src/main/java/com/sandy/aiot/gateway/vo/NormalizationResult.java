package com.sandy.aiot.gateway.vo;

import com.sandy.aiot.gateway.entity.DeviceEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Outcome of normalizing one webhook envelope: either a synchronous acknowledgment
 * (lifecycle control messages) or an ordered batch of events to enqueue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NormalizationResult {

    public enum Lifecycle { PING, CONFIRMATION, EVENT, UNINSTALL }

    private Lifecycle lifecycle;
    /** Response body for PING / CONFIRMATION; null for event batches. */
    private Map<String, Object> acknowledgment;
    @Builder.Default
    private List<DeviceEvent> events = new ArrayList<>();
    private int droppedEvents;

    public boolean isControlMessage() {
        return lifecycle != Lifecycle.EVENT;
    }
}
