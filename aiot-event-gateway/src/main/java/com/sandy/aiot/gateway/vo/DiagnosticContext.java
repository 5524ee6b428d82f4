package com.sandy.aiot.gateway.vo;

import com.sandy.aiot.gateway.entity.DeviceEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Whatever the workflow managed to gather for one request. Absent sections stay null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiagnosticContext {
    private DiagnosticIntent intent;
    private String deviceReference;
    private DeviceInfo device;
    private DeviceHealth health;
    private List<DeviceEvent> recentEvents;
    private List<Pattern> patterns;
    private List<SimilarDevice> similarDevices;
    private List<AutomationMatch> automations;
    private SystemStatusReport systemStatus;
}
