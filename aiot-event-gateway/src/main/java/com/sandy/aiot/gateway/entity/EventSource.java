package com.sandy.aiot.gateway.entity;

/**
 * Where a stored event came from.
 */
public enum EventSource {
    PLATFORM,
    WEBHOOK,
    MANUAL,
    TEST
}
