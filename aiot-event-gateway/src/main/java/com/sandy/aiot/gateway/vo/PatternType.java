package com.sandy.aiot.gateway.vo;

public enum PatternType {
    CONNECTIVITY_GAP,
    AUTOMATION_CONFLICT,
    BATTERY_DEGRADATION,
    EVENT_ANOMALY,
    REPEATED_FAILURE
}
