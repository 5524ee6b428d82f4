package com.sandy.aiot.gateway.vo;

public enum DiagnosticIntent {
    DEVICE_HEALTH(true),
    ISSUE_DIAGNOSIS(true),
    DISCOVERY(true),
    SYSTEM_STATUS(false);

    private final boolean deviceScoped;

    DiagnosticIntent(boolean deviceScoped) {
        this.deviceScoped = deviceScoped;
    }

    public boolean isDeviceScoped() {
        return deviceScoped;
    }
}
