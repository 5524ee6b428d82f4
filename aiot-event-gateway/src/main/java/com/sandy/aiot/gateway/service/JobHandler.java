package com.sandy.aiot.gateway.service;

import com.sandy.aiot.gateway.entity.QueueJob;

/**
 * Processes one queued job type. Delivery is at-least-once, so implementations must be safe to replay.
 * Any exception counts as a failed attempt.
 */
public interface JobHandler {

    String type();

    void handle(QueueJob job) throws Exception;
}
