package com.sandy.aiot.gateway.entity;

public enum JobStatus {
    PENDING,
    ACTIVE,
    COMPLETED,
    /** Retry budget exhausted; kept for inspection / manual retry. */
    FAILED
}
