package com.sandy.aiot.gateway.vo;

import com.sandy.aiot.gateway.entity.DeviceEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Stored-event query response with summary metadata.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventPage {
    private String deviceId;
    private int count;
    private long totalCount;
    private boolean hasMore;
    private boolean gapDetected;
    private List<EventGap> gaps;
    private List<DeviceEvent> events;
}
