package com.sandy.aiot.gateway.vo;

/**
 * Reach of a cross-device finding, by number of affected devices.
 */
public enum CorrelationImpact {
    LOW(Severity.INFO),
    MEDIUM(Severity.WARNING),
    HIGH(Severity.CRITICAL);

    private final Severity severity;

    CorrelationImpact(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }

    /** 2 devices LOW, 3-4 MEDIUM, 5 or more HIGH. */
    public static CorrelationImpact forDeviceCount(int devices) {
        if (devices < 2) throw new IllegalArgumentException("a correlation needs at least 2 devices, got " + devices);
        if (devices >= 5) return HIGH;
        if (devices >= 3) return MEDIUM;
        return LOW;
    }
}
