package com.sandy.aiot.gateway.vo;

import com.sandy.aiot.gateway.entity.DeviceEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Data a finding is based on. Events are copies, so a finding stays readable after the
 * originals have been purged from the store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternEvidence {
    public static final int MAX_EVENTS = 10;

    private Instant start;
    private Instant end;
    @Builder.Default
    private List<DeviceEvent> events = new ArrayList<>();
    @Builder.Default
    private Map<String, Double> metrics = new LinkedHashMap<>();

    public static List<DeviceEvent> copyOf(List<DeviceEvent> source) {
        List<DeviceEvent> out = new ArrayList<>(Math.min(source.size(), MAX_EVENTS));
        for (DeviceEvent e : source) {
            if (out.size() >= MAX_EVENTS) break;
            out.add(e.copy());
        }
        return out;
    }
}
