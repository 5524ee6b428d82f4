package com.sandy.aiot.gateway.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceHealth {
    public enum Status { ONLINE, WARNING, OFFLINE }

    private String deviceId;
    private boolean online;
    private Double batteryLevel;
    private Instant lastActivity;
    private Status status;
}
