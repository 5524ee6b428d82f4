package com.sandy.aiot.gateway.vo;

public enum Severity {
    INFO(0),
    WARNING(1),
    CRITICAL(2);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean isAtLeast(Severity other) {
        return rank >= other.rank;
    }
}
